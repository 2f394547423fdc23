package com.markrunner.engine;

import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * {@code command -v} in Java: finds an executable by walking {@code PATH}.
 */
@Component
public class ExecutableLocator {

    private final String path;

    public ExecutableLocator() {
        this(System.getenv());
    }

    public ExecutableLocator(Map<String, String> environment) {
        String p = environment.get("PATH");
        this.path = p != null ? p : "";
    }

    public Optional<Path> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        if (name.contains(File.separator)) {
            Path direct = Path.of(name);
            return isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            try {
                Path candidate = Path.of(dir, name);
                if (isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            } catch (InvalidPathException e) {
                // malformed PATH entry, keep looking
            }
        }
        return Optional.empty();
    }

    public boolean isAvailable(String name) {
        return find(name).isPresent();
    }

    private static boolean isExecutable(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }
}
