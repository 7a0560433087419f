package com.ecolityper.dispatch.cli;

import com.ecolityper.core.health.ToolHealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: ecolityper health
 * <p>
 * Verifies the interpreter and every tool module before a long run is started.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check that the analysis tools are installed")
@Component
public class HealthCommand implements Callable<Integer> {

    private final ToolHealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) ToolHealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DISABLED -> ConsoleOutput.info(label);
            }
        }

        ConsoleOutput.rule();
        if (allUp) {
            ConsoleOutput.success("Overall: all tools ready");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more tools missing");
        return 1;
    }
}
