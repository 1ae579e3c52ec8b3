package org.desugar.printer;

import com.github.javaparser.printer.configuration.ConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.Indentation;
import com.github.javaparser.printer.configuration.PrinterConfiguration;
import org.desugar.LoweringException;

/**
 * Text sink of the generator. Indentation is written lazily: a line gets its indent at the first
 * append, so empty lines stay empty and a position recorded at the start of a line stays in front
 * of the indent.
 */
public class OutputBuffer {

    private final PrinterConfiguration configuration;
    private final String indentUnit;
    private final String endOfLine;
    private final StringBuilder buf = new StringBuilder();
    private int indentLevel;

    public OutputBuffer(PrinterConfiguration configuration) {
        this.configuration = configuration;
        Indentation indentation = configuration.get(new DefaultConfigurationOption(ConfigOption.INDENTATION))
                .map(ConfigurationOption::<Indentation>asValue)
                .orElseThrow(() -> new LoweringException("no indentation configured", null));
        this.indentUnit = indentation.getIndent();
        this.endOfLine = configuration.get(new DefaultConfigurationOption(ConfigOption.END_OF_LINE_CHARACTER))
                .map(ConfigurationOption::asString)
                .orElse("\n");
    }

    /**
     * A new, empty buffer with the same configuration and the same indentation as this one.
     */
    public OutputBuffer newChild() {
        OutputBuffer child = new OutputBuffer(configuration);
        child.copyIndentFrom(this);
        return child;
    }

    public PrinterConfiguration getConfiguration() {
        return configuration;
    }

    public String getEndOfLine() {
        return endOfLine;
    }

    public OutputBuffer append(String text) {
        if (!text.isEmpty()) {
            indentIfNeeded();
            buf.append(text);
        }
        return this;
    }

    public OutputBuffer append(String... parts) {
        for (String part : parts) {
            append(part);
        }
        return this;
    }

    public OutputBuffer append(char c) {
        return append(String.valueOf(c));
    }

    public OutputBuffer appendNewLine() {
        buf.append(endOfLine);
        return this;
    }

    public OutputBuffer appendNewLine(String... parts) {
        append(parts);
        return appendNewLine();
    }

    public OutputBuffer appendNewLine(char c) {
        append(c);
        return appendNewLine();
    }

    public OutputBuffer appendSemiNewLine() {
        return appendNewLine(';');
    }

    public void openScope() {
        appendNewLine('{');
        increaseIndent();
    }

    /**
     * Closes a scope opened with {@link #openScope()}. A line break is added first unless the
     * current line is empty.
     */
    public void closeScope() {
        if (!isAtLineStart()) {
            appendNewLine();
        }
        decreaseIndent();
        append('}');
    }

    public void closeScopeWithSemi() {
        closeScope();
        append(';');
    }

    private void increaseIndent() {
        indentLevel++;
    }

    private void decreaseIndent() {
        if (indentLevel == 0) {
            throw new LoweringException("unbalanced scope: indentation would become negative", null);
        }
        indentLevel--;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public void copyIndentFrom(OutputBuffer other) {
        this.indentLevel = other.indentLevel;
    }

    /**
     * The current end of the text, usable with {@link #insertAt(int, String)}.
     */
    public int length() {
        return buf.length();
    }

    public boolean isEmpty() {
        return buf.length() == 0;
    }

    public boolean isAtLineStart() {
        return buf.length() == 0 || endsWith(endOfLine);
    }

    public boolean endsWith(String suffix) {
        int start = buf.length() - suffix.length();
        return start >= 0 && buf.indexOf(suffix, start) == start;
    }

    public char lastChar() {
        return buf.length() == 0 ? 0 : buf.charAt(buf.length() - 1);
    }

    public void insertAt(int position, String text) {
        if (position < 0 || position > buf.length()) {
            throw new LoweringException("insert position " + position + " outside of buffer of length " + buf.length(), null);
        }
        buf.insert(position, text);
    }

    private void indentIfNeeded() {
        if (isAtLineStart()) {
            for (int i = 0; i < indentLevel; i++) {
                buf.append(indentUnit);
            }
        }
    }

    public String getString() {
        return buf.toString();
    }

    @Override
    public String toString() {
        return getString();
    }
}
