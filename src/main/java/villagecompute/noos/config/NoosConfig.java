/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.noos.config;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Central configuration for noos.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code noos.config-dir} - User configuration directory holding {@code channels.txt} and optional template
 * overrides (default: {@code ${user.home}/.config/noos})</li>
 * <li>{@code noos.templates.item-path} - Explicit item template file (optional, wins over the config dir)</li>
 * <li>{@code noos.templates.page-path} - Explicit page template file (optional, wins over the config dir)</li>
 * <li>{@code noos.timeline.zone} - Zone for rendered dates and times (default: UTC)</li>
 * <li>{@code noos.fetch.timeout-seconds} - Per-feed HTTP request timeout (default: 30)</li>
 * <li>{@code noos.fetch.max-concurrency} - Feeds fetched in parallel (default: 4)</li>
 * <li>{@code noos.dump.file} - Output file of the {@code dump} command (default: noos.html)</li>
 * </ul>
 *
 * <p>
 * Every property can be overridden with a system property ({@code -Dnoos.timeline.zone=Europe/Berlin}) or the
 * matching environment variable ({@code NOOS_TIMELINE_ZONE}).
 */
@ApplicationScoped
public class NoosConfig {

    private static final Logger LOG = Logger.getLogger(NoosConfig.class);

    static final String APP_DIR_NAME = "noos";

    @ConfigProperty(
            name = "noos.config-dir")
    Optional<String> configDir;

    @ConfigProperty(
            name = "noos.templates.item-path")
    Optional<String> itemTemplatePath;

    @ConfigProperty(
            name = "noos.templates.page-path")
    Optional<String> pageTemplatePath;

    @ConfigProperty(
            name = "noos.timeline.zone",
            defaultValue = "UTC")
    String zone;

    @ConfigProperty(
            name = "noos.fetch.timeout-seconds",
            defaultValue = "30")
    int fetchTimeoutSeconds;

    @ConfigProperty(
            name = "noos.fetch.max-concurrency",
            defaultValue = "4")
    int fetchMaxConcurrency;

    @ConfigProperty(
            name = "noos.dump.file",
            defaultValue = "noos.html")
    String dumpFile;

    /**
     * Validates the configuration when the bean is first used.
     *
     * @throws NoosConfigurationException
     *             if the zone is unknown or a numeric limit is not positive
     */
    @PostConstruct
    public void validateConfiguration() {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            String errorMessage = "noos.timeline.zone is not a valid zone id: " + zone;
            LOG.fatal(errorMessage);
            throw new NoosConfigurationException(errorMessage, e);
        }
        if (fetchTimeoutSeconds <= 0) {
            throw new NoosConfigurationException(
                    "noos.fetch.timeout-seconds must be positive, got " + fetchTimeoutSeconds);
        }
        if (fetchMaxConcurrency <= 0) {
            throw new NoosConfigurationException(
                    "noos.fetch.max-concurrency must be positive, got " + fetchMaxConcurrency);
        }
        LOG.debugf("noos configured: configDir=%s, zone=%s, fetchTimeout=%ds, fetchConcurrency=%d", configDir(), zone,
                fetchTimeoutSeconds, fetchMaxConcurrency);
    }

    /**
     * @return the user configuration directory
     */
    public Path configDir() {
        return configDir.filter(dir -> !dir.isBlank()).map(Path::of)
                .orElseGet(() -> Path.of(System.getProperty("user.home"), ".config", APP_DIR_NAME));
    }

    public Optional<Path> itemTemplatePath() {
        return itemTemplatePath.filter(path -> !path.isBlank()).map(Path::of);
    }

    public Optional<Path> pageTemplatePath() {
        return pageTemplatePath.filter(path -> !path.isBlank()).map(Path::of);
    }

    public ZoneId zone() {
        return ZoneId.of(zone);
    }

    public Duration fetchTimeout() {
        return Duration.ofSeconds(fetchTimeoutSeconds);
    }

    public int fetchMaxConcurrency() {
        return fetchMaxConcurrency;
    }

    public Path dumpFile() {
        return Path.of(dumpFile);
    }

    /**
     * Exception thrown when the noos configuration is invalid.
     */
    public static class NoosConfigurationException extends RuntimeException {

        public NoosConfigurationException(String message) {
            super(message);
        }

        public NoosConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
