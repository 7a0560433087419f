package com.ecolityper.tools;

import com.ecolityper.core.model.InputMode;
import com.ecolityper.core.model.TaskPhase;
import com.ecolityper.core.model.TaskSpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The analysis tools this build knows how to run, resolved against the configured modules
 * directory. Order is the order tools are dispatched and reported.
 */
@Component
public class ToolCatalog {

    public static final String MLST = "mlst";
    public static final String SEROTYPING = "serotyping";
    public static final String CHTYPER = "chtyper";
    public static final String PHYLOGROUPING = "phylogrouping";
    public static final String ABRICATE = "abricate";
    public static final String AMRFINDER = "amrfinder";
    public static final String LINEAGE = "lineage";

    private final Path modulesDir;
    private final List<TaskSpec> tools;
    private final Predicate<String> enabledByConfig;

    @Autowired
    public ToolCatalog(ToolProperties properties) {
        this(Path.of(properties.getModulesDir()), properties::isToolEnabled);
    }

    ToolCatalog(Path modulesDir, Predicate<String> enabledByConfig) {
        this.modulesDir = modulesDir.toAbsolutePath().normalize();
        this.enabledByConfig = enabledByConfig;
        this.tools = List.of(
            new TaskSpec(MLST, "MLST", "Multi-locus sequence typing",
                    module("mlst_module"), "ecolimlst_module.py",
                    List.of("-i", TaskSpec.INPUT, "-o", "results", "-db", "db", "-sc", "bin", "--batch"),
                    InputMode.PATTERN_OR_SINGLE_FILE, TaskPhase.PARALLEL,
                    "results", "mlst_summary.tsv", List.of("UNKNOWN", "ND"), List.of("mlst_results")),
            new TaskSpec(SEROTYPING, "Serotyping", "O and H antigen determination",
                    module("serotypefinder_module"), "enhanced_serotypefinder.py",
                    List.of("-i", TaskSpec.INPUT, "-o", "Serotype", "-t", TaskSpec.THREADS),
                    InputMode.PATTERN, TaskPhase.PARALLEL,
                    "Serotype/SerotypeFinder_results", null, null, List.of("Serotype")),
            new TaskSpec(CHTYPER, "CH typing", "fumC/fimH clonotyping",
                    module("CHTyper_module"), "enhanced_chtyper.py",
                    List.of("-i", TaskSpec.INPUT, "-o", "CH_results", "-t", TaskSpec.THREADS),
                    InputMode.PATTERN, TaskPhase.PARALLEL,
                    "CH_results/chtyper_results", null, null, List.of("CH_results")),
            new TaskSpec(PHYLOGROUPING, "Phylogrouping", "Clermont phylogroup assignment",
                    module("phylogrouping_module"), "enhanced_ezclermont.py",
                    List.of("-i", TaskSpec.INPUT, "-o", "Phylo", "-t", TaskSpec.THREADS),
                    InputMode.PATTERN, TaskPhase.PARALLEL,
                    "Phylo/phylogrouping_results", null, null, List.of("Phylo")),
            new TaskSpec(ABRICATE, "ABRicate", "Resistance, virulence and plasmid gene screening",
                    module("Abricate_module"), "ecoli_abricate.py",
                    List.of(TaskSpec.INPUT, "--cpus", TaskSpec.THREADS),
                    InputMode.PATTERN, TaskPhase.PARALLEL,
                    "ecoli_abricate_results", null, null, null),
            new TaskSpec(AMRFINDER, "AMRFinderPlus", "NCBI AMR gene detection",
                    module("Amrfinder_module"), "ecoli_amrfinder.py",
                    List.of(TaskSpec.INPUT, "--cpus", TaskSpec.THREADS),
                    InputMode.PATTERN, TaskPhase.EXCLUSIVE,
                    "ecoli_amrfinder_results", null, null, null),
            new TaskSpec(LINEAGE, "Lineage reference", "E. coli lineage reference report",
                    module("Ecoli_lineage"), "ecoli_html_reference.py",
                    List.of(),
                    InputMode.NONE, TaskPhase.REFERENCE,
                    "ecoli_comprehensive_reference.html", null, null, null)
        );
    }

    private Path module(String directory) {
        return modulesDir.resolve(directory);
    }

    public Path modulesDir() {
        return modulesDir;
    }

    public List<TaskSpec> all() {
        return tools;
    }

    public List<String> names() {
        return tools.stream().map(TaskSpec::name).toList();
    }

    public Optional<TaskSpec> find(String name) {
        return tools.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    /** Whether configuration leaves the tool enabled ({@code ecolityper.tools.<name>.enabled}). */
    public boolean isEnabled(String name) {
        return enabledByConfig.test(name);
    }
}
