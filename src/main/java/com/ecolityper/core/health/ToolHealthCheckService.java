package com.ecolityper.core.health;

import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.tools.ToolCatalog;
import com.ecolityper.tools.ToolProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that the interpreter and every tool's module directory and script are in place.
 */
@Service
public class ToolHealthCheckService {

    private final ToolCatalog catalog;
    private final String interpreter;
    private final String searchPath;

    @Autowired
    public ToolHealthCheckService(ToolCatalog catalog, ToolProperties properties) {
        this(catalog, properties.getInterpreter(), System.getenv("PATH"));
    }

    ToolHealthCheckService(ToolCatalog catalog, String interpreter, String searchPath) {
        this.catalog = catalog;
        this.interpreter = interpreter;
        this.searchPath = searchPath;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkInterpreter());
        for (TaskSpec spec : catalog.all()) {
            results.add(checkTool(spec));
        }
        return results;
    }

    HealthStatus checkInterpreter() {
        if (interpreter == null || interpreter.isBlank()) {
            return new HealthStatus("interpreter", HealthStatus.Status.DOWN,
                    "No interpreter configured", Map.of());
        }
        Optional<Path> found = locate(interpreter);
        if (found.isPresent()) {
            return new HealthStatus("interpreter", HealthStatus.Status.UP,
                    "Found " + found.get(), Map.of("interpreter", interpreter));
        }
        return new HealthStatus("interpreter", HealthStatus.Status.DOWN,
                interpreter + " not found on PATH", Map.of("interpreter", interpreter));
    }

    HealthStatus checkTool(TaskSpec spec) {
        var metadata = Map.of("workspace", spec.workspace().toString(), "script", spec.script());
        if (!catalog.isEnabled(spec.name())) {
            return new HealthStatus(spec.name(), HealthStatus.Status.DISABLED,
                    "Disabled by configuration", metadata);
        }
        if (!Files.isDirectory(spec.workspace())) {
            return new HealthStatus(spec.name(), HealthStatus.Status.DOWN,
                    "Module directory not found", metadata);
        }
        if (!Files.isRegularFile(spec.scriptPath())) {
            return new HealthStatus(spec.name(), HealthStatus.Status.DOWN,
                    "Script " + spec.script() + " not found", metadata);
        }
        return new HealthStatus(spec.name(), HealthStatus.Status.UP, spec.description(), metadata);
    }

    private Optional<Path> locate(String command) {
        try {
            Path direct = Path.of(command);
            if (direct.isAbsolute() || command.contains(File.separator)) {
                return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
            }
            if (searchPath == null) {
                return Optional.empty();
            }
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (dir.isBlank()) continue;
                Path candidate = Path.of(dir).resolve(command);
                if (Files.isExecutable(candidate) && !Files.isDirectory(candidate)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
