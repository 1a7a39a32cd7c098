/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link NoosConfig} validation and derived values.
 */
class NoosConfigTest {

    private NoosConfig config;

    @BeforeEach
    void setUp() {
        config = new NoosConfig();
        config.configDir = Optional.empty();
        config.itemTemplatePath = Optional.empty();
        config.pageTemplatePath = Optional.empty();
        config.zone = "UTC";
        config.fetchTimeoutSeconds = 30;
        config.fetchMaxConcurrency = 4;
        config.dumpFile = "noos.html";
    }

    @Test
    void testValidateConfiguration_defaultsAreValid() {
        assertDoesNotThrow(() -> config.validateConfiguration());
        assertEquals(ZoneId.of("UTC"), config.zone());
        assertEquals(Duration.ofSeconds(30), config.fetchTimeout());
        assertEquals(Path.of("noos.html"), config.dumpFile());
    }

    @Test
    void testValidateConfiguration_invalidZone() {
        config.zone = "Mars/Olympus_Mons";

        assertThrows(NoosConfig.NoosConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testValidateConfiguration_nonPositiveLimits() {
        config.fetchTimeoutSeconds = 0;
        assertThrows(NoosConfig.NoosConfigurationException.class, () -> config.validateConfiguration());

        config.fetchTimeoutSeconds = 30;
        config.fetchMaxConcurrency = -1;
        assertThrows(NoosConfig.NoosConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testConfigDir_defaultsUnderUserHome() {
        Path expected = Path.of(System.getProperty("user.home"), ".config", "noos");

        assertEquals(expected, config.configDir());
    }

    @Test
    void testConfigDir_explicitValueWins() {
        config.configDir = Optional.of("/tmp/noos-config");

        assertEquals(Path.of("/tmp/noos-config"), config.configDir());
    }

    @Test
    void testTemplatePaths_blankMeansUnset() {
        config.itemTemplatePath = Optional.of("  ");
        config.pageTemplatePath = Optional.of("templates/page.html");

        assertTrue(config.itemTemplatePath().isEmpty());
        assertEquals(Optional.of(Path.of("templates/page.html")), config.pageTemplatePath());
    }
}
