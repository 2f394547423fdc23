package com.markrunner.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Predicate;

/**
 * Drains a child process's output on a daemon thread, forwarding the lines that pass the
 * filter. Draining is mandatory even with no sink, or the child blocks on a full pipe.
 */
final class OutputPump {

    private static final Logger log = LoggerFactory.getLogger(OutputPump.class);

    private final Thread thread;

    private OutputPump(Thread thread) {
        this.thread = thread;
    }

    static OutputPump start(InputStream in, PrintStream sink, Predicate<String> keep, String name) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (sink != null && keep.test(line)) {
                        sink.println(line);
                    }
                }
            } catch (IOException e) {
                log.debug("{} stream closed: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return new OutputPump(t);
    }

    void await() throws InterruptedException {
        thread.join();
    }
}
