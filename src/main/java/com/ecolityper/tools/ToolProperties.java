package com.ecolityper.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ecolityper")
public class ToolProperties {

    private Execution execution = new Execution();
    private Cleanup cleanup = new Cleanup();
    private Interrupt interrupt = new Interrupt();
    private Map<String, Tool> tools = new LinkedHashMap<>();

    // -- Execution accessors (delegate to nested) --
    public String getModulesDir() { return execution.modulesDir; }
    public String getInterpreter() { return execution.interpreter; }
    public int getDefaultThreads() { return execution.defaultThreads; }
    public int getStderrExcerptChars() { return execution.stderrExcerptChars; }

    // -- Cleanup accessors (delegate to nested) --
    public List<String> getPurgeDirectories() { return cleanup.purgeDirectories; }
    public List<String> getTempPatterns() { return cleanup.tempPatterns; }

    public int getInterruptCleanupTimeoutSeconds() { return interrupt.cleanupTimeoutSeconds; }

    /**
     * Whether a tool is enabled by configuration. Tools without an entry are enabled.
     */
    public boolean isToolEnabled(String name) {
        Tool tool = tools.get(name);
        return tool == null || tool.enabled;
    }

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Cleanup getCleanup() { return cleanup; }
    public void setCleanup(Cleanup cleanup) { this.cleanup = cleanup; }
    public Interrupt getInterrupt() { return interrupt; }
    public void setInterrupt(Interrupt interrupt) { this.interrupt = interrupt; }
    public Map<String, Tool> getTools() { return tools; }
    public void setTools(Map<String, Tool> tools) { this.tools = tools; }

    public static class Execution {
        private String modulesDir = "modules";
        private String interpreter = "python3";
        private int defaultThreads = 2;
        private int stderrExcerptChars = 200;

        public String getModulesDir() { return modulesDir; }
        public void setModulesDir(String modulesDir) { this.modulesDir = modulesDir; }
        public String getInterpreter() { return interpreter; }
        public void setInterpreter(String interpreter) { this.interpreter = interpreter; }
        public int getDefaultThreads() { return defaultThreads; }
        public void setDefaultThreads(int defaultThreads) { this.defaultThreads = defaultThreads; }
        public int getStderrExcerptChars() { return stderrExcerptChars; }
        public void setStderrExcerptChars(int stderrExcerptChars) { this.stderrExcerptChars = stderrExcerptChars; }
    }

    public static class Cleanup {
        private List<String> purgeDirectories = new ArrayList<>(List.of(
                "mlst_results", "results", "SerotypeFinder_results",
                "chtyper_results", "phylogrouping_results",
                "ecoli_abricate_results", "ecoli_amrfinder_results"));
        private List<String> tempPatterns = new ArrayList<>(List.of(
                "*.txt", "*.log", "*.tmp", "temp_*", "*.html", "*.tsv"));

        public List<String> getPurgeDirectories() { return purgeDirectories; }
        public void setPurgeDirectories(List<String> purgeDirectories) { this.purgeDirectories = purgeDirectories; }
        public List<String> getTempPatterns() { return tempPatterns; }
        public void setTempPatterns(List<String> tempPatterns) { this.tempPatterns = tempPatterns; }
    }

    public static class Interrupt {
        private int cleanupTimeoutSeconds = 30;

        public int getCleanupTimeoutSeconds() { return cleanupTimeoutSeconds; }
        public void setCleanupTimeoutSeconds(int cleanupTimeoutSeconds) { this.cleanupTimeoutSeconds = cleanupTimeoutSeconds; }
    }

    public static class Tool {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
