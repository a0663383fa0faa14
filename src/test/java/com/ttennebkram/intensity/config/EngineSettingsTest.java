package com.ttennebkram.intensity.config;

import static org.junit.jupiter.api.Assertions.*;

import com.ttennebkram.intensity.model.TransformParameters;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

class EngineSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaults() {
        EngineSettings settings = EngineSettings.loadDefaults();
        assertEquals("Own (Parallel Rows)", settings.getDefaultStrategy());
        assertEquals(0, settings.getWorkerThreads());
        assertEquals(TransformParameters.IDENTITY, settings.getParameters());
        assertEquals(0.0, settings.getContrastRange().min);
        assertEquals(2.0, settings.getContrastRange().max);
        assertEquals(0.01, settings.getContrastRange().step);
        assertEquals(-100.0, settings.getBrightnessRange().min);
        assertEquals(100.0, settings.getBrightnessRange().max);
    }

    @Test
    void userFileOverridesOnlyGivenKeys() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{ \"defaultStrategy\": \"Own (Sequential)\", \"offset\": 25.0 }",
                          StandardCharsets.UTF_8);

        EngineSettings settings = EngineSettings.load(file);

        assertEquals("Own (Sequential)", settings.getDefaultStrategy());
        assertEquals(1.0, settings.getParameters().getScale());
        assertEquals(25.0, settings.getParameters().getOffset());
        assertEquals(2.0, settings.getContrastRange().max);
    }

    @Test
    void saveThenLoadKeepsValues() throws IOException {
        EngineSettings settings = EngineSettings.loadDefaults();
        settings.setDefaultStrategy("Own (Parallel)");
        settings.setWorkerThreads(3);
        settings.setParameters(TransformParameters.of(1.75, -40.0));

        Path file = tempDir.resolve("saved.json");
        settings.save(file);
        EngineSettings loaded = EngineSettings.load(file);

        assertEquals("Own (Parallel)", loaded.getDefaultStrategy());
        assertEquals(3, loaded.getWorkerThreads());
        assertEquals(TransformParameters.of(1.75, -40.0), loaded.getParameters());
        assertTrue(Files.readString(file).contains("\n"), "expected pretty-printed JSON");
    }

    @Test
    void partialRangeKeepsOtherBounds() {
        EngineSettings settings = EngineSettings.loadDefaults();
        settings.merge(new StringReader("{ \"brightnessRange\": { \"max\": 50 } }"), "test");
        assertEquals(-100.0, settings.getBrightnessRange().min);
        assertEquals(50.0, settings.getBrightnessRange().max);
        assertTrue(settings.getBrightnessRange().contains(0.0));
        assertFalse(settings.getBrightnessRange().contains(51.0));
    }

    @Test
    void malformedJsonIsReported() {
        EngineSettings settings = EngineSettings.loadDefaults();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> settings.merge(new StringReader("{ \"scale\": "), "broken.json"));
        assertTrue(e.getMessage().contains("broken.json"));

        assertThrows(IllegalArgumentException.class,
                () -> settings.merge(new StringReader("[1, 2]"), "array.json"));
        assertThrows(IllegalArgumentException.class,
                () -> settings.merge(new StringReader("{ \"contrastRange\": 3 }"), "range.json"));
    }

    @Test
    void missingFileIsAnIOException() {
        assertThrows(IOException.class, () -> EngineSettings.load(tempDir.resolve("absent.json")));
    }
}
