package com.pbscache.collector.apps;

import com.pbscache.core.model.AppDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppRegistryLoaderTest {

    @TempDir
    Path dir;

    private AppRegistryLoader loader;

    @BeforeEach
    void setUp() {
        loader = new AppRegistryLoader();
    }

    @Test
    void loadsDescriptorsKeyedByFileName() throws IOException {
        Files.writeString(dir.resolve("vasp.toml"), String.join("\n",
            "Name = \"VASP\"",
            "DefaultMinCores = 4",
            "MaxCores = 128",
            "DefaultVersion = \"6.4\"",
            "Versions = [\"6.3\", \"6.4\"]",
            "MPI = true",
            "MaxGPU = 4",
            "DefaultGPU = 1",
            "DefaultCoreWithGPU = 8"));
        Files.writeString(dir.resolve("gromacs.2023.toml"), "Name = \"GROMACS\"\nOpenMP = 8\n");
        Files.writeString(dir.resolve("README.md"), "not an app");

        Map<String, AppDescriptor> registry = loader.load(dir);

        assertEquals(List.of("gromacs", "vasp"), List.copyOf(registry.keySet()));
        AppDescriptor vasp = registry.get("vasp");
        assertEquals("VASP", vasp.getName());
        assertEquals(128, vasp.getMaxCores());
        assertEquals(List.of("6.3", "6.4"), vasp.getVersions());
        assertTrue(vasp.getMpi());
        assertEquals(8, vasp.getDefaultCoreWithGpu());

        AppDescriptor gromacs = registry.get("gromacs");
        assertEquals(8, gromacs.getOpenMp());
        assertEquals(0, gromacs.getMaxCores());
        assertEquals(-1, gromacs.getDefaultCoreWithGpu());
        assertTrue(gromacs.getVersions().isEmpty());
    }

    @Test
    void missingNameIsRejected() throws IOException {
        Files.writeString(dir.resolve("broken.toml"), "MaxCores = 16\n");

        IOException e = assertThrows(IOException.class, () -> loader.load(dir));
        assertTrue(e.getMessage().contains("missing Name"));
    }

    @Test
    void invalidTomlIsRejected() throws IOException {
        Files.writeString(dir.resolve("broken.toml"), "Name = \n");

        assertThrows(IOException.class, () -> loader.load(dir));
    }

    @Test
    void emptyDirectoryGivesEmptyRegistry() throws IOException {
        assertTrue(loader.load(dir).isEmpty());
    }
}
