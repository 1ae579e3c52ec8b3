package org.desugar;

import com.github.javaparser.printer.configuration.PrinterConfiguration;
import org.desugar.ast.Node;
import org.desugar.ast.type.DefaultTypeNamePrinter;
import org.desugar.ast.type.TypeNamePrinter;
import org.desugar.diagnostics.DiagnosticListener;
import org.desugar.diagnostics.Diagnostics;
import org.desugar.diagnostics.Severity;
import org.desugar.lambda.LambdaStack;
import org.desugar.printer.CodeGenerator;
import org.desugar.printer.DefaultPrototypePrinter;
import org.desugar.printer.LoweringContext;
import org.desugar.printer.OutputBuffer;
import org.desugar.printer.PrototypePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: lowers a resolved tree to explicit source text.
 * <pre>
 * LoweringResult result = Desugar.builder()
 *         .configuration(DesugarConfiguration.fromSystemProperties())
 *         .build()
 *         .lower(translationUnit);
 * </pre>
 * Instances hold no per-run state and may be shared between threads; every call to
 * {@link #lower(Node)} uses its own buffer, closure stack and diagnostics.
 */
public final class Desugar {

    private static final Logger LOGGER = LoggerFactory.getLogger(Desugar.class);

    private final DesugarConfiguration configuration;
    private final PrinterConfiguration printerConfiguration;
    private final TypeNamePrinter typeNamePrinter;
    private final PrototypePrinter prototypePrinter;
    private final DiagnosticListener listener;

    private Desugar(Builder builder) {
        this.configuration = builder.configuration;
        this.printerConfiguration = configuration.toPrinterConfiguration();
        this.typeNamePrinter = builder.typeNamePrinter;
        this.prototypePrinter = builder.prototypePrinter != null
                                ? builder.prototypePrinter
                                : new DefaultPrototypePrinter(typeNamePrinter);
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DesugarConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Lowers {@code root}. Constructs that cannot be lowered are reported as diagnostics and
     * replaced by a placeholder comment.
     *
     * @throws IncompleteLoweringException in strict mode, when an error was reported
     * @throws LoweringException on an internal error of the generator
     */
    public LoweringResult lower(Node root) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        LOGGER.debug("lowering {}", root.getKindName());

        Diagnostics diagnostics = new Diagnostics(listener);
        OutputBuffer out = new OutputBuffer(printerConfiguration);
        LoweringContext context = new LoweringContext(typeNamePrinter, prototypePrinter, diagnostics);

        new CodeGenerator(out, new LambdaStack(), context).insertArg(root);

        LoweringResult result = new LoweringResult(out.getString(), diagnostics.getAll());
        LOGGER.debug("lowered {} into {} characters, {} diagnostics",
                     root.getKindName(), result.getSource().length(), result.getDiagnostics().size());

        if (configuration.isStrict() && diagnostics.hasErrors()) {
            throw new IncompleteLoweringException("lowering of " + root.getKindName() + " is incomplete: "
                                                  + diagnostics.count(Severity.ERROR) + " error(s)",
                                                  result.getSource(), result.getDiagnostics());
        }
        return result;
    }

    public static final class Builder {

        private DesugarConfiguration configuration = DesugarConfiguration.fromSystemProperties();
        private TypeNamePrinter typeNamePrinter = DefaultTypeNamePrinter.INSTANCE;
        private PrototypePrinter prototypePrinter;
        private DiagnosticListener listener;

        private Builder() {
        }

        public Builder configuration(DesugarConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder typeNamePrinter(TypeNamePrinter typeNamePrinter) {
            this.typeNamePrinter = typeNamePrinter;
            return this;
        }

        /**
         * Defaults to a {@link DefaultPrototypePrinter} over the configured type name printer.
         */
        public Builder prototypePrinter(PrototypePrinter prototypePrinter) {
            this.prototypePrinter = prototypePrinter;
            return this;
        }

        public Builder listener(DiagnosticListener listener) {
            this.listener = listener;
            return this;
        }

        public Desugar build() {
            if (configuration == null || typeNamePrinter == null) {
                throw new IllegalStateException("configuration and type name printer are required");
            }
            return new Desugar(this);
        }
    }
}
