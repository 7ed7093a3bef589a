package infra.sql;

import domain.source.SqlSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads {@code .sql} sources from a single file or, recursively, from a directory.
 *
 * <p>Files are read as UTF-8 with a leading BOM removed, and returned sorted by relative
 * path so runs are reproducible. Invalid bytes are replaced rather than failing the scan.</p>
 */
public final class SqlSourceScanner {

    public List<SqlSource> scan(Path input) {
        if (input == null) throw new IllegalArgumentException("input is null");
        if (!Files.exists(input)) throw new IllegalArgumentException("input not found: " + input);

        if (Files.isRegularFile(input)) {
            return List.of(read(input, input.getFileName().toString()));
        }

        List<Path> files;
        try (Stream<Path> s = Files.walk(input)) {
            files = s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql"))
                    .sorted(Comparator.comparing(p -> relativeName(input, p)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan sql directory: " + input, e);
        }

        List<SqlSource> out = new ArrayList<>(files.size());
        for (Path p : files) {
            out.add(read(p, relativeName(input, p)));
        }
        return out;
    }

    private static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static SqlSource read(Path file, String name) {
        try {
            // malformed bytes decode to U+FFFD, which the lexer reports per statement
            return new SqlSource(name, stripBom(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sql file: " + file, e);
        }
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
