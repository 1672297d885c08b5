package infra.text;

import domain.text.SqlSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Collects the SQL input files under an input path.
 *
 * <p>A single file is returned as is; a directory is walked recursively for {@code .sql} and
 * {@code .txt} files, sorted by relative path so runs are reproducible.</p>
 */
public final class SqlFileScanner {

    public static final Set<String> EXTENSIONS = Set.of(".sql", ".txt");

    static boolean isSqlFile(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (name.endsWith(ext)) return true;
        }
        return false;
    }

    public List<SqlSource> scan(Path input) {
        if (input == null) throw new IllegalArgumentException("input is null");
        if (!Files.exists(input)) throw new IllegalArgumentException("input not found: " + input);

        if (Files.isRegularFile(input)) {
            return List.of(new SqlSource(input, input.getFileName().toString()));
        }

        Path root = input.toAbsolutePath().normalize();
        List<SqlSource> out = new ArrayList<>(256);
        try (Stream<Path> s = Files.walk(root)) {
            s.filter(Files::isRegularFile)
                    .filter(SqlFileScanner::isSqlFile)
                    .forEach(p -> out.add(new SqlSource(p, root.relativize(p).toString())));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan sql files under: " + root, e);
        }
        out.sort(Comparator.comparing(SqlSource::getRelativePath));
        return out;
    }
}
