package org.pdemeta.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. reference.conf (lowest priority)
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String TOLERANCE_KEY = "pdemeta.analysis.bound-tolerance";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(TOLERANCE_KEY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Missing file should fall back to reference.conf")
    void load_withoutFile_shouldUseReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("absent.conf").toFile());

        // Assert
        assertEquals(AnalysisSettings.DEFAULT_BOUND_TOLERANCE, config.getDouble(TOLERANCE_KEY));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("File should override reference.conf and keep the other defaults")
    void load_withFile_shouldOverrideReference() throws IOException {
        // Arrange
        File file = writeConfig(TOLERANCE_KEY + " = 1e-4");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(1e-4, config.getDouble(TOLERANCE_KEY));
        assertEquals(AnalysisSettings.DEFAULT_MIN_DOMAIN_WIDTH, config.getDouble("pdemeta.analysis.min-domain-width"));
    }

    @Test
    @DisplayName("System property should override the file")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = writeConfig(TOLERANCE_KEY + " = 1e-4");
        System.setProperty(TOLERANCE_KEY, "1e-3");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(1e-3, config.getDouble(TOLERANCE_KEY));
    }

    @Test
    @DisplayName("Substitutions in the file should be resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        File file = writeConfig("""
            base-tolerance = 1e-5
            pdemeta.analysis.bound-tolerance = ${base-tolerance}
            """);

        Config config = ConfigLoader.load(file);

        assertEquals(1e-5, config.getDouble(TOLERANCE_KEY));
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content);
        return file.toFile();
    }
}
