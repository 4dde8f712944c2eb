package org.pdemeta.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for reading {@link AnalysisSettings} from HOCON.
 */
@Tag("unit")
class AnalysisSettingsTest {

    @Test
    @DisplayName("Missing block should yield the defaults")
    void fromConfig_withoutBlock_shouldUseDefaults() {
        assertEquals(AnalysisSettings.DEFAULTS, AnalysisSettings.fromConfig(ConfigFactory.empty()));
    }

    @Test
    @DisplayName("Absent keys should fall back individually")
    void fromConfig_withPartialBlock_shouldFallBackPerKey() {
        // Arrange
        Config config = ConfigFactory.parseString("pdemeta.analysis.bound-tolerance = 1e-6");

        // Act
        AnalysisSettings settings = AnalysisSettings.fromConfig(config);

        // Assert
        assertEquals(1e-6, settings.boundTolerance());
        assertEquals(AnalysisSettings.DEFAULT_MIN_DOMAIN_WIDTH, settings.minDomainWidth());
    }

    @Test
    @DisplayName("Width not exceeding twice the tolerance should be rejected")
    void fromConfig_withWidthBelowTolerance_shouldThrowBadValue() {
        Config config = ConfigFactory.parseString("""
            pdemeta.analysis {
              bound-tolerance = 0.1
              min-domain-width = 0.2
            }
            """);

        ConfigException.BadValue e = assertThrows(ConfigException.BadValue.class, () -> AnalysisSettings.fromConfig(config));
        assertTrue(e.getMessage().contains("min-domain-width"));
    }

    @Test
    @DisplayName("Negative tolerance should be rejected")
    void constructor_withNegativeTolerance_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisSettings(-1e-9, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisSettings(Double.NaN, 1e-6));
    }

    @Test
    @DisplayName("Non-numeric value should surface as a config error")
    void fromConfig_withText_shouldThrowWrongType() {
        Config config = ConfigFactory.parseString("pdemeta.analysis.bound-tolerance = tight");

        assertThrows(ConfigException.WrongType.class, () -> AnalysisSettings.fromConfig(config));
    }

    @Test
    @DisplayName("Classpath reference configuration should carry the defaults")
    void fromConfig_withReferenceConf_shouldMatchDefaults() {
        assertEquals(AnalysisSettings.DEFAULTS, AnalysisSettings.fromConfig(ConfigFactory.parseResources("reference.conf")));
    }
}
