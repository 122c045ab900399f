package org.dxworks.adocframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AdocframeConfigTest {

    @TempDir
    Path dir;

    @Test
    void missing_file_gives_defaults() {
        AdocframeConfig config = AdocframeConfig.load(dir.resolve(AdocframeConfig.CONFIG_FILE_NAME));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(64, config.getMaxIncludeDepth());
        assertTrue(config.isPrettyPrintHtml());
    }

    @Test
    void reads_values_from_yaml() throws IOException {
        Path file = Files.writeString(dir.resolve("config.yml"),
                "maxFileLines: 500\nmaxIncludeDepth: 4\nprettyPrintHtml: false\n");

        AdocframeConfig config = AdocframeConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals(4, config.getMaxIncludeDepth());
        assertFalse(config.isPrettyPrintHtml());
        assertEquals(4, config.toParserOptions().getMaxIncludeDepth());
    }

    @Test
    void non_positive_limits_fall_back_to_defaults() throws IOException {
        Path file = Files.writeString(dir.resolve("config.yml"), "maxFileLines: 0\nmaxIncludeDepth: -3\n");

        AdocframeConfig config = AdocframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(64, config.getMaxIncludeDepth());
        assertTrue(config.isPrettyPrintHtml());
    }

    @Test
    void unreadable_yaml_gives_defaults() throws IOException {
        Path file = Files.writeString(dir.resolve("config.yml"), "maxFileLines: [not, a, number]\n");

        assertEquals(20000, AdocframeConfig.load(file).getMaxFileLines());
    }

    @Test
    void explicit_values_are_sanitized() {
        AdocframeConfig config = AdocframeConfig.with(-1, 0, false);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(64, config.getMaxIncludeDepth());
        assertFalse(config.isPrettyPrintHtml());
    }
}
