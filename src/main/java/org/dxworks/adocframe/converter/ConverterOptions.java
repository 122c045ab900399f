package org.dxworks.adocframe.converter;

import java.util.Objects;

public class ConverterOptions {

    private final boolean prettyPrint;
    private final boolean standalone;
    private final String outputEncoding;

    private ConverterOptions(boolean prettyPrint, boolean standalone, String outputEncoding) {
        this.prettyPrint = prettyPrint;
        this.standalone = standalone;
        this.outputEncoding = outputEncoding;
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(true, true, "UTF-8");
    }

    public ConverterOptions prettyPrint(boolean prettyPrint) {
        return new ConverterOptions(prettyPrint, standalone, outputEncoding);
    }

    /**
     * @param standalone true to wrap the body in a full HTML page, false for the body markup only
     */
    public ConverterOptions standalone(boolean standalone) {
        return new ConverterOptions(prettyPrint, standalone, outputEncoding);
    }

    public ConverterOptions outputEncoding(String outputEncoding) {
        return new ConverterOptions(prettyPrint, standalone, Objects.requireNonNull(outputEncoding, "outputEncoding"));
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public boolean isStandalone() {
        return standalone;
    }

    public String getOutputEncoding() {
        return outputEncoding;
    }
}
