package org.dxworks.adocframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.adocframe.parser.ParserOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AdocframeConfig {

    private static final Logger LOGGER = Logger.getLogger(AdocframeConfig.class.getName());

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_INCLUDE_DEPTH = ParserOptions.DEFAULT_MAX_INCLUDE_DEPTH;
    private static final boolean DEFAULT_PRETTY_PRINT_HTML = true;
    static final String CONFIG_FILE_NAME = "adocframe-config.yml";

    private final int maxFileLines;
    private final int maxIncludeDepth;
    private final boolean prettyPrintHtml;

    private AdocframeConfig(int maxFileLines, int maxIncludeDepth, boolean prettyPrintHtml) {
        this.maxFileLines = maxFileLines;
        this.maxIncludeDepth = maxIncludeDepth;
        this.prettyPrintHtml = prettyPrintHtml;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    public boolean isPrettyPrintHtml() {
        return prettyPrintHtml;
    }

    public static AdocframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static AdocframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                int effectiveMaxIncludeDepth = (yamlConfig.maxIncludeDepth != null && yamlConfig.maxIncludeDepth > 0)
                        ? yamlConfig.maxIncludeDepth
                        : DEFAULT_MAX_INCLUDE_DEPTH;
                boolean effectivePrettyPrintHtml = (yamlConfig.prettyPrintHtml != null)
                        ? yamlConfig.prettyPrintHtml
                        : DEFAULT_PRETTY_PRINT_HTML;

                return new AdocframeConfig(effectiveMaxFileLines, effectiveMaxIncludeDepth, effectivePrettyPrintHtml);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read " + configPath + ", using defaults", e);
        }

        return defaults();
    }

    public static AdocframeConfig with(int maxFileLines, int maxIncludeDepth, boolean prettyPrintHtml) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxIncludeDepth = maxIncludeDepth > 0 ? maxIncludeDepth : DEFAULT_MAX_INCLUDE_DEPTH;
        return new AdocframeConfig(effectiveMaxFileLines, effectiveMaxIncludeDepth, prettyPrintHtml);
    }

    private static AdocframeConfig defaults() {
        return new AdocframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_INCLUDE_DEPTH, DEFAULT_PRETTY_PRINT_HTML);
    }

    public ParserOptions toParserOptions() {
        return ParserOptions.defaults().maxIncludeDepth(maxIncludeDepth);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxIncludeDepth;
        public Boolean prettyPrintHtml;
    }
}
