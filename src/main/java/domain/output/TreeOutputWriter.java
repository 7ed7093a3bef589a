package domain.output;

import java.nio.file.Path;

/** Stores the tree dump of one source file. */
public interface TreeOutputWriter {

    void write(Path outDir, String sourceName, String dump);
}
