package com.markrunner.engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Extracts the bundled shell worker so the external dispatchers can invoke it by path.
 */
final class WorkerScript {

    static final String RESOURCE = "/engine/unit-worker.sh";
    static final String FILE_NAME = "unit-worker.sh";

    private WorkerScript() {}

    static Path extractTo(Path dir) throws IOException {
        Path target = dir.resolve(FILE_NAME);
        if (Files.exists(target)) return target;
        try (InputStream in = WorkerScript.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Worker script resource " + RESOURCE + " is missing from the classpath");
            }
            Files.createDirectories(dir);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        target.toFile().setExecutable(true);
        return target;
    }
}
