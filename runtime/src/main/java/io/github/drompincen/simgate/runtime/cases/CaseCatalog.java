package io.github.drompincen.simgate.runtime.cases;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Built-in case files under a root directory.
 */
public class CaseCatalog {

    private static final Logger log = LoggerFactory.getLogger(CaseCatalog.class);
    private static final Set<String> EXTENSIONS = Set.of(".xlsx", ".raw");

    private final Path root;

    public CaseCatalog(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Relative paths, with forward slashes, of every case file under the root, sorted.
     */
    public List<String> listCases() {
        if (!Files.isDirectory(root)) {
            log.debug("Cases directory {} does not exist", root);
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(CaseCatalog::isCaseFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan cases directory " + root, e);
        }
    }

    /**
     * Resolves a case name against the root first, then as a plain path.
     */
    public Optional<Path> resolve(String casePath) {
        if (casePath == null || casePath.isBlank()) {
            return Optional.empty();
        }
        try {
            Path builtIn = root.resolve(casePath).normalize();
            if (builtIn.startsWith(root) && Files.isRegularFile(builtIn)) {
                return Optional.of(builtIn);
            }
            Path direct = Path.of(casePath);
            return Files.isRegularFile(direct) ? Optional.of(direct) : Optional.empty();
        } catch (InvalidPathException e) {
            log.debug("Rejected case path {}: {}", casePath, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isCaseFile(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
