package com.ecolityper.tools;

import com.ecolityper.core.model.InputMode;
import com.ecolityper.core.model.TaskPhase;
import com.ecolityper.core.model.TaskSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolCatalogTest {

    @TempDir
    Path modules;

    @Test
    @DisplayName("Catalog lists the seven tools in dispatch order")
    void allTools() {
        var catalog = new ToolCatalog(modules, name -> true);

        assertEquals(List.of("mlst", "serotyping", "chtyper", "phylogrouping", "abricate", "amrfinder", "lineage"),
                catalog.names());
    }

    @Test
    @DisplayName("AMRFinderPlus runs alone and the lineage report takes no inputs")
    void phases() {
        var catalog = new ToolCatalog(modules, name -> true);

        assertEquals(5, catalog.all().stream().filter(t -> t.phase() == TaskPhase.PARALLEL).count());
        TaskSpec amrfinder = catalog.find(ToolCatalog.AMRFINDER).orElseThrow();
        assertTrue(amrfinder.isExclusive());
        TaskSpec lineage = catalog.find(ToolCatalog.LINEAGE).orElseThrow();
        assertEquals(TaskPhase.REFERENCE, lineage.phase());
        assertEquals(InputMode.NONE, lineage.inputMode());
        assertFalse(lineage.stagesInputs());
    }

    @Test
    @DisplayName("Module directories resolve under the configured modules directory")
    void moduleResolution() {
        var catalog = new ToolCatalog(modules, name -> true);

        TaskSpec mlst = catalog.find(ToolCatalog.MLST).orElseThrow();
        assertEquals(modules.toAbsolutePath().normalize(), catalog.modulesDir());
        assertEquals(catalog.modulesDir().resolve("mlst_module"), mlst.workspace());
        assertEquals(mlst.workspace().resolve("ecolimlst_module.py"), mlst.scriptPath());
        assertEquals(InputMode.PATTERN_OR_SINGLE_FILE, mlst.inputMode());
        assertEquals(List.of("UNKNOWN", "ND"), mlst.warningMarkers());
    }

    @Test
    void enabledFollowsConfiguration() {
        var properties = new ToolProperties();
        properties.getExecution().setModulesDir(modules.toString());
        var off = new ToolProperties.Tool();
        off.setEnabled(false);
        properties.getTools().put("chtyper", off);

        var catalog = new ToolCatalog(properties);

        assertFalse(catalog.isEnabled("chtyper"));
        assertTrue(catalog.isEnabled("mlst"));
    }

    @Test
    void unknownToolIsAbsent() {
        assertTrue(new ToolCatalog(modules, name -> true).find("kraken").isEmpty());
    }
}
