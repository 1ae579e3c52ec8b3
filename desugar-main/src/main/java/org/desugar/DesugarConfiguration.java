package org.desugar;

import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.Indentation;
import com.github.javaparser.printer.configuration.Indentation.IndentType;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

import java.util.Locale;
import java.util.Properties;

/**
 * Settings of a {@link Desugar} instance. Defaults come from system properties.
 */
public final class DesugarConfiguration {

    public static final String INDENT_SIZE_PROPERTY = "desugar.indent.size";
    public static final String INDENT_TYPE_PROPERTY = "desugar.indent.type";
    public static final String EOL_PROPERTY = "desugar.eol";
    public static final String STRICT_PROPERTY = "desugar.strict";

    private final int indentSize;
    private final IndentType indentType;
    private final String endOfLine;
    private final boolean strict;

    public DesugarConfiguration(int indentSize, IndentType indentType, String endOfLine, boolean strict) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indent size must not be negative: " + indentSize);
        }
        if (endOfLine == null || endOfLine.isEmpty()) {
            throw new IllegalArgumentException("end of line must not be empty");
        }
        this.indentSize = indentSize;
        this.indentType = indentType;
        this.endOfLine = endOfLine;
        this.strict = strict;
    }

    public static DesugarConfiguration fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static DesugarConfiguration fromProperties(Properties properties) {
        int size = Integer.parseInt(properties.getProperty(INDENT_SIZE_PROPERTY, "2").trim());
        IndentType type = IndentType.valueOf(properties.getProperty(INDENT_TYPE_PROPERTY, "SPACES").trim().toUpperCase(Locale.ROOT));
        String eol = unescape(properties.getProperty(EOL_PROPERTY, "\n"));
        boolean strict = Boolean.parseBoolean(properties.getProperty(STRICT_PROPERTY, "false").trim());
        return new DesugarConfiguration(size, type, eol, strict);
    }

    // allows -Ddesugar.eol=\r\n on a command line
    private static String unescape(String value) {
        return value.replace("\\r", "\r").replace("\\n", "\n");
    }

    public int getIndentSize() {
        return indentSize;
    }

    public IndentType getIndentType() {
        return indentType;
    }

    public String getEndOfLine() {
        return endOfLine;
    }

    public boolean isStrict() {
        return strict;
    }

    public DesugarConfiguration withIndentSize(int size) {
        return new DesugarConfiguration(size, indentType, endOfLine, strict);
    }

    public DesugarConfiguration withIndentType(IndentType type) {
        return new DesugarConfiguration(indentSize, type, endOfLine, strict);
    }

    public DesugarConfiguration withEndOfLine(String eol) {
        return new DesugarConfiguration(indentSize, indentType, eol, strict);
    }

    public DesugarConfiguration withStrict(boolean strictMode) {
        return new DesugarConfiguration(indentSize, indentType, endOfLine, strictMode);
    }

    /**
     * The printer configuration handed to output buffers.
     */
    public PrinterConfiguration toPrinterConfiguration() {
        return new DefaultPrinterConfiguration()
                .addOption(new DefaultConfigurationOption(ConfigOption.INDENTATION, new Indentation(indentType, indentSize)))
                .addOption(new DefaultConfigurationOption(ConfigOption.END_OF_LINE_CHARACTER, endOfLine));
    }
}
