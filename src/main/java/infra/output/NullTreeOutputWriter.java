package infra.output;

import domain.output.TreeOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullTreeOutputWriter implements TreeOutputWriter {
    @Override
    public void write(Path outDir, String sourceName, String dump) {
        // intentionally no-op
    }
}
