package infra.output;

import domain.output.TreeDumpFileNamePolicy;
import domain.output.TreeOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link TreeOutputWriter} that stores dumps as UTF-8 files.
 * <p>
 * Output layout: {@code <outDir>/<TreeDumpFileNamePolicy.build(sourceName)>}
 */
public final class FileTreeOutputWriter implements TreeOutputWriter {

    @Override
    public void write(Path outDir, String sourceName, String dump) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        try {
            Files.createDirectories(outDir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + outDir, e);
        }

        Path target = outDir.resolve(TreeDumpFileNamePolicy.build(sourceName));
        try {
            Files.writeString(target, dump == null ? "" : dump, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write tree dump: " + target, e);
        }
    }
}
