package com.hrx.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("hrx.yaml");
        Files.writeString(configFile, """
            defaultBoundaryLength: 5
            maxInputLength: 1048576
            autoResizeBoundary: true
            """);

        HrxConfig config = ConfigLoader.load(configFile);

        assertThat(config.defaultBoundaryLength()).isEqualTo(5);
        assertThat(config.maxInputLength()).isEqualTo(1048576);
        assertThat(config.autoResizeBoundary()).isTrue();
        assertThat(config.hasInputLimit()).isTrue();
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hrx.yaml");
        Files.writeString(configFile, """
            autoResizeBoundary: true
            unknownSetting: ignored
            """);

        HrxConfig config = ConfigLoader.load(configFile);

        assertThat(config.defaultBoundaryLength()).isEqualTo(HrxConfig.DEFAULT_BOUNDARY_LENGTH);
        assertThat(config.maxInputLength()).isZero();
        assertThat(config.hasInputLimit()).isFalse();
        assertThat(config.autoResizeBoundary()).isTrue();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        HrxConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(HrxConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hrx.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(HrxConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hrx.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(HrxConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = tempDir.resolve("directory");
        Files.createDirectory(directory);

        assertThat(ConfigLoader.load(directory)).isEqualTo(HrxConfig.defaults());
    }

    @Test
    void load_nullPath_throwsNullPointer() {
        assertThatThrownBy(() -> ConfigLoader.load(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("configPath");
    }

    @Test
    void fromYaml_validYaml_returnsConfig() {
        HrxConfig config = ConfigLoader.fromYaml("defaultBoundaryLength: 8\n");

        assertThat(config.defaultBoundaryLength()).isEqualTo(8);
        assertThat(config.autoResizeBoundary()).isFalse();
    }

    @Test
    void fromYaml_blank_returnsDefaults() {
        assertThat(ConfigLoader.fromYaml("  ")).isEqualTo(HrxConfig.defaults());
    }

    @Test
    void fromYaml_invalidYaml_throwsException() {
        assertThatThrownBy(() -> ConfigLoader.fromYaml("defaultBoundaryLength: [not, a, number]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid HRX configuration");
    }
}
