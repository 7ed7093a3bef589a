package cli;

import java.nio.file.Files;

import java.nio.file.Path;

import java.nio.file.Paths;

import java.util.Map;

/** CLI path resolver (baseDir and paths relative to it). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";

    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = (argv == null) ? null : argv.get("baseDir");
        if (bd == null || bd.isBlank()) return;
        System.setProperty(PROP_BASE_DIR, bd.trim());
    }
    public static Path resolveBaseDir() {
        String bd = System.getProperty(PROP_BASE_DIR);
        if (bd != null && !bd.isBlank()) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }
    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }
    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }
    public static void validateExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
    }

    /** Default output location next to the input: {@code <input dir>/cst-out}. */
    public static Path defaultOutDir(Path input) {
        Path dir = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();
        return dir.resolve("cst-out").toAbsolutePath().normalize();
    }
}
