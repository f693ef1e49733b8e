package com.msgpattern.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("loader-test.source");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void loadCustomConfigFile() throws IOException {
        Path configFile = tempDir.resolve("custom.conf");
        Files.writeString(configFile, """
            loader-test {
              source = "file"
              retries = 5
            }
            """);

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("file", config.getString("loader-test.source"));
        assertEquals(5, config.getInt("loader-test.retries"));
    }

    @Test
    void loadMultipleConfigFiles_laterOverridesEarlier() throws IOException {
        Path baseConfig = tempDir.resolve("base.conf");
        Files.writeString(baseConfig, """
            loader-test {
              source = "base"
              retries = 1
            }
            """);

        Path overrideConfig = tempDir.resolve("override.conf");
        Files.writeString(overrideConfig, """
            loader-test {
              retries = 9
            }
            """);

        Config config = ConfigLoader.load(List.of(baseConfig.toString(), overrideConfig.toString()));

        assertEquals("base", config.getString("loader-test.source"));
        assertEquals(9, config.getInt("loader-test.retries"));
    }

    @Test
    void loadFromClasspathWhenNoFileExists() {
        Config config = ConfigLoader.load("loader-test.conf");

        assertEquals("classpath", config.getString("loader-test.source"));
        assertEquals(3, config.getInt("loader-test.retries"));
    }

    @Test
    void missingConfigFileIsRejected() {
        String missing = tempDir.resolve("does-not-exist.conf").toString();

        ConfigLoader.ConfigurationException e = assertThrows(ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("does-not-exist.conf"));
    }

    @Test
    void unparseableConfigFileIsRejected() throws IOException {
        Path broken = tempDir.resolve("broken.conf");
        Files.writeString(broken, "loader-test { source = ");

        assertThrows(ConfigLoader.ConfigurationException.class, () -> ConfigLoader.load(broken.toString()));
    }

    @Test
    void systemPropertiesOverrideFiles() throws IOException {
        Path configFile = tempDir.resolve("custom.conf");
        Files.writeString(configFile, "loader-test.source = \"file\"\n");

        System.setProperty("loader-test.source", "system");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("system", config.getString("loader-test.source"));
    }

    @Test
    void referenceDefaultsApplyWithoutFiles() {
        Config config = ConfigLoader.load(List.of());

        assertEquals("reference", config.getString("loader-test.origin"));
    }

    @Test
    void substitutionsAreResolved() throws IOException {
        Path configFile = tempDir.resolve("subst.conf");
        Files.writeString(configFile, """
            loader-test {
              base = "x"
              derived = ${loader-test.base}"y"
            }
            """);

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("xy", config.getString("loader-test.derived"));
    }
}
