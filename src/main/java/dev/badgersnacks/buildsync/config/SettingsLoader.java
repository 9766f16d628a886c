package dev.badgersnacks.buildsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads optional {@link UpdaterSettings}. Missing or malformed files fall back to the defaults.
 */
public final class SettingsLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public UpdaterSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return UpdaterSettings.defaults();
        }
        try {
            UpdaterSettings settings = MAPPER.readValue(settingsFile.toFile(), UpdaterSettings.class);
            if (settings == null) {
                LOGGER.warn("Settings file {} is empty. Using defaults.", settingsFile);
                return UpdaterSettings.defaults();
            }
            LOGGER.info("Loaded settings from {}", settingsFile);
            return settings;
        } catch (IOException e) {
            LOGGER.warn("Failed to read settings from {}. Using defaults.", settingsFile, e);
            return UpdaterSettings.defaults();
        }
    }
}
