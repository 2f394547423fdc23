package com.markrunner.dispatch.cli;

import com.markrunner.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: markrunner health
 * <p>
 * Reports which execution backends this host supports and whether the work dir is usable.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        boolean down = false;
        boolean degraded = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    down = true;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    degraded = true;
                }
            }
        }

        ConsoleOutput.rule();
        if (down) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        if (degraded) {
            ConsoleOutput.info("Overall: operational with fallbacks");
        } else {
            ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
