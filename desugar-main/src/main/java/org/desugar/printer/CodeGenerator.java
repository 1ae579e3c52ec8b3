package org.desugar.printer;

import com.github.javaparser.utils.StringEscapeUtils;
import org.desugar.DesugarException;
import org.desugar.LoweringException;
import org.desugar.ast.Node;
import org.desugar.ast.TemplateArgument;
import org.desugar.ast.decl.AccessSpecDecl;
import org.desugar.ast.decl.BaseSpecifier;
import org.desugar.ast.decl.BindingDecl;
import org.desugar.ast.decl.CtorInitializer;
import org.desugar.ast.decl.Decl;
import org.desugar.ast.decl.DecompositionDecl;
import org.desugar.ast.decl.FieldDecl;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.MethodDecl;
import org.desugar.ast.decl.ParmVarDecl;
import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.decl.StaticAssertDecl;
import org.desugar.ast.decl.StorageClass;
import org.desugar.ast.decl.TranslationUnitDecl;
import org.desugar.ast.decl.TypeAliasDecl;
import org.desugar.ast.decl.TypedefDecl;
import org.desugar.ast.decl.UnsupportedDecl;
import org.desugar.ast.decl.UsingDecl;
import org.desugar.ast.decl.ValueDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.ArrayInitIndexExpr;
import org.desugar.ast.expr.ArrayInitLoopExpr;
import org.desugar.ast.expr.ArraySubscriptExpr;
import org.desugar.ast.expr.BinaryOperator;
import org.desugar.ast.expr.BindTemporaryExpr;
import org.desugar.ast.expr.BoolLiteralExpr;
import org.desugar.ast.expr.CStyleCastExpr;
import org.desugar.ast.expr.CallExpr;
import org.desugar.ast.expr.CastKind;
import org.desugar.ast.expr.CharLiteralExpr;
import org.desugar.ast.expr.ConditionalOperator;
import org.desugar.ast.expr.ConstructExpr;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.DefaultArgExpr;
import org.desugar.ast.expr.DefaultInitExpr;
import org.desugar.ast.expr.DeleteExpr;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.expr.ExprWithCleanups;
import org.desugar.ast.expr.FloatingLiteralExpr;
import org.desugar.ast.expr.FunctionalCastExpr;
import org.desugar.ast.expr.GnuNullExpr;
import org.desugar.ast.expr.ImplicitCastExpr;
import org.desugar.ast.expr.InitListExpr;
import org.desugar.ast.expr.IntegerLiteralExpr;
import org.desugar.ast.expr.LambdaCapture;
import org.desugar.ast.expr.LambdaExpr;
import org.desugar.ast.expr.MaterializeTemporaryExpr;
import org.desugar.ast.expr.MemberCallExpr;
import org.desugar.ast.expr.MemberExpr;
import org.desugar.ast.expr.NamedCastExpr;
import org.desugar.ast.expr.NewExpr;
import org.desugar.ast.expr.NullPtrLiteralExpr;
import org.desugar.ast.expr.OpaqueValueExpr;
import org.desugar.ast.expr.OperatorCallExpr;
import org.desugar.ast.expr.ParenExpr;
import org.desugar.ast.expr.PredefinedExpr;
import org.desugar.ast.expr.SizeOfAlignOfExpr;
import org.desugar.ast.expr.StdInitializerListExpr;
import org.desugar.ast.expr.StringLiteralExpr;
import org.desugar.ast.expr.SubstNonTypeTemplateParmExpr;
import org.desugar.ast.expr.ThisExpr;
import org.desugar.ast.expr.TypeidExpr;
import org.desugar.ast.expr.UnaryOperator;
import org.desugar.ast.expr.UnaryOperatorKind;
import org.desugar.ast.expr.UnresolvedLookupExpr;
import org.desugar.ast.expr.UnsupportedExpr;
import org.desugar.ast.stmt.BreakStmt;
import org.desugar.ast.stmt.CaseStmt;
import org.desugar.ast.stmt.CompoundStmt;
import org.desugar.ast.stmt.ContinueStmt;
import org.desugar.ast.stmt.DeclStmt;
import org.desugar.ast.stmt.DefaultStmt;
import org.desugar.ast.stmt.DoStmt;
import org.desugar.ast.stmt.ForStmt;
import org.desugar.ast.stmt.IfStmt;
import org.desugar.ast.stmt.NullStmt;
import org.desugar.ast.stmt.RangeForStmt;
import org.desugar.ast.stmt.ReturnStmt;
import org.desugar.ast.stmt.Stmt;
import org.desugar.ast.stmt.SwitchStmt;
import org.desugar.ast.stmt.UnsupportedStmt;
import org.desugar.ast.stmt.WhileStmt;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.PointerType;
import org.desugar.ast.type.ReferenceType;
import org.desugar.ast.type.Type;
import org.desugar.ast.type.TypeNamePrinter;
import org.desugar.ast.visitor.VoidVisitor;
import org.desugar.diagnostics.Diagnostics;
import org.desugar.lambda.LambdaCallerType;
import org.desugar.lambda.LambdaContext;
import org.desugar.lambda.LambdaScope;
import org.desugar.lambda.LambdaStack;
import org.desugar.util.NameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-emits a resolved tree as explicit source text.
 * <p>
 * One {@code visit} per node kind writes that node to the {@link OutputBuffer}. Most kinds print
 * as written; closures, decompositions, range-based loops, overloaded operator calls, non-trivial
 * function-local statics and meaningful implicit casts are lowered to the equivalent explicit
 * form. Closure classes are hoisted in front of the statement that uses them through the
 * {@link LambdaStack}.
 * <p>
 * Subclasses replace the output of single node kinds, see {@link StructuredBindingsCodeGenerator},
 * {@link LambdaCodeGenerator} and {@link ArrayInitCodeGenerator}.
 */
public class CodeGenerator implements VoidVisitor<Void> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CodeGenerator.class);

    private static final String OPERATOR = "operator";

    protected final OutputBuffer out;
    protected final LambdaStack lambdaStack;
    protected final LoweringContext context;

    public CodeGenerator(OutputBuffer out, LambdaStack lambdaStack, LoweringContext context) {
        this.out = out;
        this.lambdaStack = lambdaStack;
        this.context = context;
    }

    public OutputBuffer getOutput() {
        return out;
    }

    /**
     * Lowers {@code node} into the output buffer. A null node prints nothing.
     */
    public void insertArg(Node node) {
        if (node == null) {
            LOGGER.trace("skipping null node");
            return;
        }
        LOGGER.trace("lowering {}", node);
        try {
            node.accept(this, null);
        } catch (DesugarException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LoweringException("failed to lower " + node + ": " + e.getMessage(), node.toString(), e);
        }
    }

    protected void insertArgs(List<? extends Node> nodes) {
        boolean first = true;
        for (Node node : nodes) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            insertArg(node);
        }
    }

    protected void insertArgWithParensIfNeeded(Expr expr) {
        Expr inner = expr.ignoreImplicit();
        boolean needParens = inner instanceof UnaryOperator
                             && ((UnaryOperator) inner).getOperator() == UnaryOperatorKind.DEREF;

        if (needParens) {
            out.append('(');
        }
        insertArg(expr);
        if (needParens) {
            out.append(')');
        }
    }

    /**
     * Braces around an initializer unless it brings its own.
     */
    protected void insertCurlysIfRequired(Expr init) {
        boolean requiresCurlys = !(init instanceof InitListExpr)
                                 && !(init instanceof ParenExpr)
                                 && !(init instanceof DefaultInitExpr);
        if (requiresCurlys) {
            out.append('{');
        }
        insertArg(init);
        if (requiresCurlys) {
            out.append('}');
        }
    }

    protected void insertPlaceholder(Node node) {
        out.append("/* [TODO] unsupported: ", node.getKindName(), " */");
        diagnostics().warning(node, "unsupported construct: " + node.getKindName());
    }

    protected Diagnostics diagnostics() {
        return context.getDiagnostics();
    }

    protected TypeNamePrinter typeNames() {
        return context.getTypeNamePrinter();
    }

    protected String getName(Type type) {
        return typeNames().getName(type);
    }

    protected String getTypeNameAsParameter(Type type, String name) {
        return typeNames().getTypeNameAsParameter(type, name);
    }

    /**
     * A generator of the same kind writing to {@code buffer}, used for text rendered out of line.
     */
    protected CodeGenerator withBuffer(OutputBuffer buffer) {
        return new CodeGenerator(buffer, lambdaStack, context);
    }

    protected LambdaScope pushLambdaScope(LambdaCallerType callerType) {
        return lambdaStack.push(callerType, out);
    }

    protected LambdaScope pushLambdaScope(LambdaCallerType callerType, int insertPosition) {
        return lambdaStack.push(callerType, out, insertPosition);
    }

    // ---------------------------------------------------------------- statements

    @Override
    public void visit(CompoundStmt n, Void arg) {
        out.openScope();
        handleCompoundStmt(n);
        out.closeScope();
    }

    /**
     * The items of a block, without the braces.
     */
    protected void handleCompoundStmt(CompoundStmt n) {
        for (Stmt item : n.getBody()) {
            insertArg(item);

            if (needsSemicolon(item)) {
                out.appendSemiNewLine();
            } else if (!out.isAtLineStart()) {
                out.appendNewLine();
            }
        }
    }

    /**
     * Whether a statement printed as a block item still needs its terminating semicolon.
     */
    protected static boolean needsSemicolon(Stmt stmt) {
        if (stmt instanceof CaseStmt) {
            return needsSemicolon(((CaseStmt) stmt).getSubStmt());
        }
        if (stmt instanceof DefaultStmt) {
            return needsSemicolon(((DefaultStmt) stmt).getSubStmt());
        }
        return !(stmt instanceof CompoundStmt
                 || stmt instanceof IfStmt
                 || stmt instanceof ForStmt
                 || stmt instanceof RangeForStmt
                 || stmt instanceof WhileStmt
                 || stmt instanceof DoStmt
                 || stmt instanceof SwitchStmt
                 || stmt instanceof DeclStmt
                 || stmt instanceof NullStmt);
    }

    /**
     * A loop or branch body, always in braces. A body that is not a block gets a scope of its own
     * so that classes hoisted in front of it stay under the branch.
     */
    private void insertBody(Stmt body) {
        if (body instanceof CompoundStmt) {
            insertArg(body);
            return;
        }

        out.openScope();
        if (body != null && !(body instanceof NullStmt)) {
            insertArg(body);
            if (needsSemicolon(body)) {
                out.appendSemiNewLine();
            }
        }
        out.closeScope();
    }

    @Override
    public void visit(DeclStmt n, Void arg) {
        for (Decl decl : n.getDecls()) {
            insertArg(decl);
        }
    }

    @Override
    public void visit(NullStmt n, Void arg) {
        out.appendSemiNewLine();
    }

    @Override
    public void visit(IfStmt n, Void arg) {
        boolean hasInit = n.getInit() != null || n.getConditionVariable() != null;

        if (hasInit) {
            out.openScope();
            insertArg(n.getConditionVariable());
            insertArg(n.getInit());
        }

        try (LambdaScope header = pushLambdaScope(LambdaCallerType.CONTROL_STMT)) {
            out.append("if", n.isConstexpr() ? " constexpr" : "", "(");
            insertArg(n.getCondition());
            out.append(") ");
        }

        insertBody(n.getThen());

        Stmt elseStmt = n.getElse();
        if (elseStmt != null) {
            out.append(" else ", n.isConstexpr() ? "/* constexpr */ " : "");
            insertBody(elseStmt);
        }

        out.appendNewLine();

        if (hasInit) {
            out.closeScope();
            out.appendNewLine();
        }
    }

    @Override
    public void visit(ForStmt n, Void arg) {
        // closures of the header, the init included, go in front of the loop
        try (LambdaScope header = pushLambdaScope(LambdaCallerType.CONTROL_STMT)) {
            out.append("for(");

            Stmt init = n.getInit();
            if (init != null) {
                out.append(renderForInit(init), " ");
            } else {
                out.append("; ");
            }

            insertArg(n.getCondition());
            out.append("; ");
            insertArg(n.getIncrement());
            out.append(")");
            out.appendNewLine();
        }

        insertBody(n.getBody());
        out.appendNewLine();
    }

    /**
     * The init-statement on a single line, terminated by exactly one semicolon.
     */
    private String renderForInit(Stmt init) {
        OutputBuffer scratch = new OutputBuffer(out.getConfiguration());
        withBuffer(scratch).insertArg(init);

        String eol = out.getEndOfLine();
        String text = scratch.getString().trim();
        if (!eol.isBlank()) {
            text = text.replace(eol, " ");
        }
        return text.endsWith(";") ? text : text + ";";
    }

    @Override
    public void visit(RangeForStmt n, Void arg) {
        out.openScope();

        insertArg(n.getRangeStmt());
        insertArg(n.getBeginStmt());
        insertArg(n.getEndStmt());

        out.appendNewLine();

        out.append("for( ; ");
        insertArg(n.getCondition());
        out.append("; ");
        insertArg(n.getIncrement());
        out.appendNewLine(" )");

        out.openScope();

        insertArg(n.getLoopVariable());

        Stmt body = n.getBody();
        boolean bodyBraced = body instanceof CompoundStmt;

        // the loop scope is already open
        if (bodyBraced) {
            handleCompoundStmt((CompoundStmt) body);
        } else {
            insertArg(body);
        }

        if (!bodyBraced && !(body instanceof NullStmt)) {
            out.appendSemiNewLine();
        }

        out.closeScope();
        out.closeScope();
    }

    @Override
    public void visit(WhileStmt n, Void arg) {
        try (LambdaScope header = pushLambdaScope(LambdaCallerType.CONTROL_STMT)) {
            out.append("while(");
            insertArg(n.getCondition());
            out.append(") ");
        }

        insertBody(n.getBody());
        out.appendNewLine();
    }

    @Override
    public void visit(DoStmt n, Void arg) {
        int loopStart = out.length();
        out.append("do ");
        insertBody(n.getBody());

        try (LambdaScope condition = pushLambdaScope(LambdaCallerType.CONTROL_STMT, loopStart)) {
            out.append(" while(");
            insertArg(n.getCondition());
            out.appendNewLine(");");
        }
    }

    @Override
    public void visit(SwitchStmt n, Void arg) {
        boolean hasInit = n.getInit() != null || n.getConditionVariable() != null;

        if (hasInit) {
            out.openScope();
            insertArg(n.getConditionVariable());
            insertArg(n.getInit());
        }

        try (LambdaScope header = pushLambdaScope(LambdaCallerType.CONTROL_STMT)) {
            out.append("switch(");
            insertArg(n.getCondition());
            out.append(") ");
        }

        insertArg(n.getBody());

        if (hasInit) {
            out.closeScope();
        }
    }

    @Override
    public void visit(CaseStmt n, Void arg) {
        out.append("case ");
        insertArg(n.getValue());
        out.append(": ");
        insertArg(n.getSubStmt());
    }

    @Override
    public void visit(DefaultStmt n, Void arg) {
        out.append("default: ");
        insertArg(n.getSubStmt());
    }

    @Override
    public void visit(BreakStmt n, Void arg) {
        out.append("break");
    }

    @Override
    public void visit(ContinueStmt n, Void arg) {
        out.append("continue");
    }

    @Override
    public void visit(ReturnStmt n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.RETURN_STMT)) {
            out.append("return");

            Expr value = n.getReturnValue();
            if (value != null) {
                out.append(' ');
                insertArg(value);
            }
        }
    }

    @Override
    public void visit(UnsupportedStmt n, Void arg) {
        insertPlaceholder(n);
    }

    // ---------------------------------------------------------------- literals

    @Override
    public void visit(IntegerLiteralExpr n, Void arg) {
        out.append(n.getValue().toString());
        insertSuffix(n.getType());
    }

    @Override
    public void visit(FloatingLiteralExpr n, Void arg) {
        out.append(n.getValueText());
        insertSuffix(n.getType());
    }

    private void insertSuffix(Type type) {
        Type canonical = type.getCanonicalType();
        if (canonical instanceof BuiltinType) {
            out.append(((BuiltinType) canonical).getKind().getLiteralSuffix());
        }
    }

    @Override
    public void visit(CharLiteralExpr n, Void arg) {
        out.append(n.getCharacterKind().getPrefix());
        out.append(charLiteral(n.getValue()));
    }

    static String charLiteral(int value) {
        switch (value) {
            case '\\':
                return "'\\\\'";
            case 0:
                return "'\\0'";
            case '\'':
                return "'\\''";
            case 7:
                return "'\\a'";
            case '\b':
                return "'\\b'";
            case '\f':
                return "'\\f'";
            case '\n':
                return "'\\n'";
            case '\r':
                return "'\\r'";
            case '\t':
                return "'\\t'";
            case 11:
                return "'\\v'";
            default:
                if (value >= 0x20 && value < 0x7f) {
                    return "'" + (char) value + "'";
                }
                return "'\\x" + Integer.toHexString(value) + "'";
        }
    }

    @Override
    public void visit(StringLiteralExpr n, Void arg) {
        out.append(n.getCharacterKind().getPrefix(), "\"", StringEscapeUtils.escapeJava(n.getValue()), "\"");
    }

    @Override
    public void visit(BoolLiteralExpr n, Void arg) {
        out.append(n.getValue() ? "true" : "false");
    }

    @Override
    public void visit(NullPtrLiteralExpr n, Void arg) {
        out.append("nullptr");
    }

    @Override
    public void visit(GnuNullExpr n, Void arg) {
        out.append("NULL");
    }

    // ---------------------------------------------------------------- references

    @Override
    public void visit(DeclRefExpr n, Void arg) {
        out.append(n.getName());
        insertTemplateArgs(n);
    }

    @Override
    public void visit(UnresolvedLookupExpr n, Void arg) {
        out.append(n.getName());
    }

    @Override
    public void visit(ThisExpr n, Void arg) {
        out.append("this");
    }

    @Override
    public void visit(MemberExpr n, Void arg) {
        insertArg(n.getBase());

        out.append(n.isArrow() ? "->" : ".");

        ValueDecl member = n.getMemberDecl();
        if (member instanceof MethodDecl) {
            MethodDecl method = (MethodDecl) member;
            RecordDecl parent = method.getParent();

            // a closure's static invoker is reached through its conversion operator
            if (parent != null && parent.isLambda()) {
                out.append(OPERATOR, " ", NameUtils.getLambdaName(parent), "::retType");
                return;
            }

            out.append(n.getMemberName());
            if (method.getTemplateSpecializationArgs() != null) {
                insertTemplateArgs(method.getTemplateSpecializationArgs());
            }
            return;
        }

        out.append(n.getMemberName());
    }

    // ---------------------------------------------------------------- operators

    @Override
    public void visit(UnaryOperator n, Void arg) {
        String spelling = n.getOperator().getSpelling();

        if (!n.isPostfix()) {
            out.append(spelling);
        }
        insertArg(n.getSubExpr());
        if (n.isPostfix()) {
            out.append(spelling);
        }
    }

    @Override
    public void visit(BinaryOperator n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.BINARY_OPERATOR)) {
            insertArg(n.getLhs());
            out.append(" ", n.getOperator().getSpelling(), " ");
            insertArg(n.getRhs());
        }
    }

    @Override
    public void visit(ConditionalOperator n, Void arg) {
        insertArg(n.getCondition());
        out.append(" ? ");
        insertArg(n.getTrueExpr());
        out.append(" : ");
        insertArg(n.getFalseExpr());
    }

    @Override
    public void visit(ParenExpr n, Void arg) {
        out.append('(');
        insertArg(n.getSubExpr());
        out.append(')');
    }

    @Override
    public void visit(ArraySubscriptExpr n, Void arg) {
        insertArg(n.getLhs());
        out.append('[');
        insertArg(n.getRhs());
        out.append(']');
    }

    @Override
    public void visit(SizeOfAlignOfExpr n, Void arg) {
        out.append(n.getKind().getKeyword());

        if (n.isArgumentType()) {
            out.append("(", getName(n.getArgumentType()), ")");
        } else if (n.getArgumentExpr() instanceof ParenExpr) {
            insertArg(n.getArgumentExpr());
        } else {
            out.append('(');
            insertArg(n.getArgumentExpr());
            out.append(')');
        }
    }

    @Override
    public void visit(TypeidExpr n, Void arg) {
        out.append("typeid(");
        if (n.isTypeOperand()) {
            out.append(getName(n.getTypeOperand()));
        } else {
            insertArg(n.getExprOperand());
        }
        out.append(')');
    }

    // ---------------------------------------------------------------- calls

    @Override
    public void visit(CallExpr n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.CALL_EXPR)) {
            insertArg(n.getCallee());

            if (n.isUserDefinedLiteral()) {
                insertUserDefinedLiteralArgs(n);
            }

            out.append('(');
            insertArgs(n.getArgs());
            out.append(')');
        }
    }

    /**
     * The template arguments of a literal operator template. A single character pack, as in
     * {@code 123_x}, prints as character literals.
     */
    private void insertUserDefinedLiteralArgs(CallExpr n) {
        FunctionDecl literalOperator = n.getDirectCallee();
        if (literalOperator == null || literalOperator.getTemplateSpecializationArgs() == null) {
            return;
        }

        List<TemplateArgument> args = literalOperator.getTemplateSpecializationArgs();
        if (args.size() != 1 || args.get(0).getKind() != TemplateArgument.Kind.PACK) {
            insertTemplateArgs(args);
            return;
        }

        out.append('<');
        boolean first = true;
        for (TemplateArgument element : args.get(0).getPackElements()) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            out.append(charLiteral(element.getAsIntegral().intValue()));
        }
        out.append('>');
    }

    @Override
    public void visit(MemberCallExpr n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.MEMBER_CALL_EXPR)) {
            insertArg(n.getCallee());
            out.append('(');
            insertArgs(n.getArgs());
            out.append(')');
        }
    }

    @Override
    public void visit(OperatorCallExpr n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.OPERATOR_CALL_EXPR)) {
            Expr calleeExpr = n.getCallee().ignoreImpCasts();
            DeclRefExpr callee = calleeExpr instanceof DeclRefExpr ? (DeclRefExpr) calleeExpr : null;
            boolean isMethod = callee != null && callee.getDecl() instanceof MethodDecl;

            if (n.getNumArgs() == 2 && callee != null) {
                Expr first = n.getArg(0).ignoreImpCasts();
                Expr second = n.getArg(1).ignoreImpCasts();

                if (first instanceof DeclRefExpr && second instanceof DeclRefExpr) {
                    String lhs = ((DeclRefExpr) first).getName();
                    String rhs = ((DeclRefExpr) second).getName();

                    if (isMethod) {
                        out.append(lhs, ".", callee.getName(), "(", rhs, ")");
                    } else {
                        out.append(callee.getName(), "(", lhs, ", ", rhs, ")");
                    }
                    return;
                }
            }

            if (callee == null || !(callee.getDecl() instanceof FunctionDecl)) {
                LOGGER.debug("operator call without a function callee, printing it as a plain call: {}", n);
                insertArg(n.getCallee());
                out.append('(');
                insertArgs(n.getArgs());
                out.append(')');
                return;
            }

            if (!isMethod) {
                out.append(callee.getName(), "(");
            }

            insertArgWithParensIfNeeded(n.getArg(0));

            if (isMethod) {
                out.append(".", OPERATOR, n.getOperator().getSpelling(), "(");
            }

            List<Expr> rest = n.getArgs().subList(1, n.getNumArgs());
            if (isMethod) {
                insertArgs(rest);
            } else {
                for (Expr e : rest) {
                    out.append(", ");
                    insertArg(e);
                }
            }

            out.append(')');
        }
    }

    @Override
    public void visit(ConstructExpr n, Void arg) {
        out.append(typeNames().getName(n.getType().getCanonicalType(), true));

        boolean curlys = n.isListInitialization();
        out.append(curlys ? '{' : '(');
        insertArgs(n.getArgs());
        out.append(curlys ? '}' : ')');
    }

    @Override
    public void visit(NewExpr n, Void arg) {
        out.append("new ");

        if (!n.getPlacementArgs().isEmpty()) {
            out.append('(');
            insertArgs(n.getPlacementArgs());
            out.append(") ");
        }

        Expr init = n.getInitializer();
        if (init instanceof ConstructExpr && !n.isArray()) {
            insertArg(init);
            return;
        }

        out.append(getName(n.getAllocatedType()));

        if (n.isArray()) {
            out.append('[');
            insertArg(n.getArraySize());
            out.append(']');
        }

        if (init != null) {
            insertCurlysIfRequired(init);
        }
    }

    @Override
    public void visit(DeleteExpr n, Void arg) {
        out.append("delete");
        if (n.isArrayForm()) {
            out.append("[]");
        }
        out.append(' ');
        insertArg(n.getArgument());
    }

    // ---------------------------------------------------------------- initialization

    @Override
    public void visit(InitListExpr n, Void arg) {
        out.append('{');
        insertArgs(n.getInits());
        out.append('}');
    }

    @Override
    public void visit(StdInitializerListExpr n, Void arg) {
        out.append(typeNames().getName(n.getType(), true));
        insertArg(n.getSubExpr());
    }

    @Override
    public void visit(ArrayInitLoopExpr n, Void arg) {
        out.append('{');
        for (long i = 0; i < n.getArraySize(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            new ArrayInitCodeGenerator(out, lambdaStack, context, i).insertArg(n.getSubExpr());
        }
        out.append('}');
    }

    @Override
    public void visit(ArrayInitIndexExpr n, Void arg) {
        diagnostics().error(n, "array init index outside of an array init loop");
        insertPlaceholder(n);
    }

    @Override
    public void visit(DefaultArgExpr n, Void arg) {
        insertArg(n.getExpr());
    }

    @Override
    public void visit(DefaultInitExpr n, Void arg) {
        insertArg(n.getExpr());
    }

    // ---------------------------------------------------------------- transparent wrappers

    @Override
    public void visit(ExprWithCleanups n, Void arg) {
        insertArg(n.getSubExpr());
    }

    @Override
    public void visit(MaterializeTemporaryExpr n, Void arg) {
        insertArg(n.getSubExpr());
    }

    @Override
    public void visit(BindTemporaryExpr n, Void arg) {
        insertArg(n.getSubExpr());
    }

    @Override
    public void visit(OpaqueValueExpr n, Void arg) {
        insertArg(n.getSourceExpr());
    }

    @Override
    public void visit(SubstNonTypeTemplateParmExpr n, Void arg) {
        insertArg(n.getReplacement());
    }

    @Override
    public void visit(PredefinedExpr n, Void arg) {
        insertArg(n.getFunctionName());
    }

    @Override
    public void visit(UnsupportedExpr n, Void arg) {
        insertPlaceholder(n);
    }

    // ---------------------------------------------------------------- casts

    @Override
    public void visit(ImplicitCastExpr n, Void arg) {
        Expr subExpr = n.getSubExpr();
        CastKind castKind = n.getCastKind();

        if (!castKind.isSemanticallyMeaningful()) {
            insertArg(subExpr);
            return;
        }

        if (subExpr instanceof IntegerLiteralExpr) {
            insertArg(subExpr);
            return;
        }

        boolean reinterpret = castKind == CastKind.BIT_CAST;
        String castName = reinterpret ? "reinterpret_cast" : "static_cast";
        boolean asComment = !reinterpret && subExpr instanceof ThisExpr;

        formatCast(castName, n.getType().getCanonicalType(), subExpr, castKind, asComment);
    }

    @Override
    public void visit(NamedCastExpr n, Void arg) {
        formatCast(n.getCastName().getSpelling(), n.getType().getCanonicalType(), n.getSubExpr(), n.getCastKind(), false);
    }

    @Override
    public void visit(CStyleCastExpr n, Void arg) {
        String castName = n.getCastKind().isReinterpreting() ? "reinterpret_cast" : "static_cast";
        formatCast(castName, n.getType().getCanonicalType(), n.getSubExpr(), n.getCastKind(), false);
    }

    @Override
    public void visit(FunctionalCastExpr n, Void arg) {
        Expr subExpr = n.getSubExpr();
        boolean isConstructor = subExpr instanceof ConstructExpr;
        boolean isStdListInit = subExpr instanceof StdInitializerListExpr;
        boolean needsParens = !isConstructor && !n.isListInitialization() && !isStdListInit;

        // a construct expression prints the type name itself
        if (!isConstructor && !isStdListInit) {
            out.append(getName(n.getType()));
        }

        if (needsParens) {
            out.append('(');
        }
        insertArg(subExpr);
        if (needsParens) {
            out.append(')');
        }
    }

    /**
     * {@code castName<Type>(subExpr)}. As a comment only the cast syntax is commented out, the
     * operand stays live.
     */
    protected void formatCast(String castName, Type destType, Expr subExpr, CastKind castKind, boolean asComment) {
        boolean isCastToBase = castKind.isDerivedToBase() && destType.isRecordType();
        String destTypeText = getName(destType) + (isCastToBase && !destType.isPointerType() ? "&" : "");

        String head = castName + "<" + destTypeText + ">(";
        if (asComment) {
            out.append("/*", head, "*/");
            insertArg(subExpr);
            out.append("/*)*/");
            return;
        }

        out.append(head);
        insertArg(subExpr);
        out.append(')');
    }

    // ---------------------------------------------------------------- closures

    @Override
    public void visit(LambdaExpr n, Void arg) {
        if (!lambdaStack.isEmpty()) {
            handleLambdaExpr(n, lambdaStack.back());
            out.append(NameUtils.getLambdaName(n));
        } else {
            try (LambdaScope scope = pushLambdaScope(LambdaCallerType.LAMBDA_EXPR)) {
                handleLambdaExpr(n, scope.getContext());
            }
        }

        if (!lambdaStack.isEmpty()) {
            lambdaStack.back().insertInits(out);
        }
    }

    /**
     * Writes the class of closure {@code lambda} into the side buffer of {@code lambdaContext}.
     */
    protected void handleLambdaExpr(LambdaExpr lambda, LambdaContext lambdaContext) {
        LambdaCallerType callerType = lambdaContext.getCallerType();
        OutputBuffer classBuffer = lambdaContext.getBuffer();
        RecordDecl lambdaClass = lambda.getLambdaClass();
        MethodDecl callOp = lambda.getCallOperator();
        String lambdaTypeName = NameUtils.getLambdaName(lambda);

        LOGGER.debug("hoisting {} for {}", lambdaTypeName, callerType);

        classBuffer.appendNewLine();
        classBuffer.appendNewLine("class ", lambdaTypeName);
        classBuffer.openScope();

        if (lambda.isGenericLambda()) {
            boolean haveConversionOperator = false;
            for (MethodDecl conversion : lambdaClass.getConversions()) {
                for (FunctionDecl spec : conversion.getSpecializations()) {
                    if (spec instanceof MethodDecl) {
                        haveConversionOperator = true;
                        insertMethod(classBuffer, (MethodDecl) spec, (MethodDecl) spec);
                    }
                }
            }

            List<FunctionDecl> callOpSpecs = callOp.getSpecializations();
            for (FunctionDecl spec : callOpSpecs) {
                if (spec instanceof MethodDecl) {
                    insertMethod(classBuffer, (MethodDecl) spec, (MethodDecl) spec);
                }
            }

            MethodDecl invoker = lambdaClass.getLambdaStaticInvoker();
            if (haveConversionOperator && invoker != null) {
                List<FunctionDecl> invokerSpecs = invoker.getSpecializations();
                for (int i = 0; i < invokerSpecs.size(); i++) {
                    if (invokerSpecs.get(i) instanceof MethodDecl) {
                        FunctionDecl bodySource = i < callOpSpecs.size() ? callOpSpecs.get(i) : callOp;
                        insertMethod(classBuffer, (MethodDecl) invokerSpecs.get(i), (MethodDecl) bodySource);
                    }
                }
            }
        } else {
            boolean haveConversionOperator = false;
            for (MethodDecl conversion : lambdaClass.getConversions()) {
                // undeduced conversions have no body
                if (conversion.hasBody()) {
                    haveConversionOperator = true;
                    insertMethod(classBuffer, conversion, conversion);
                }
            }

            insertMethod(classBuffer, callOp, callOp);

            MethodDecl invoker = lambdaClass.getLambdaStaticInvoker();
            if (haveConversionOperator && invoker != null) {
                insertMethod(classBuffer, invoker, callOp);
            }
        }

        String inits = insertCaptures(lambda, lambdaTypeName, classBuffer);

        classBuffer.closeScope();

        if (callerType.keepsInitsAtUseSite()) {
            lambdaContext.appendInits(inits);
        } else {
            classBuffer.append(" ", lambdaTypeName, inits);
        }

        classBuffer.appendNewLine(';');
        classBuffer.appendNewLine();
    }

    /**
     * Fields and constructor for the captures. Returns the initializer list for the use site.
     */
    private String insertCaptures(LambdaExpr lambda, String lambdaTypeName, OutputBuffer classBuffer) {
        StringBuilder ctor = new StringBuilder("public: ").append(lambdaTypeName).append('(');
        List<String> ctorInits = new ArrayList<>();
        StringBuilder inits = new StringBuilder("{");

        if (lambda.getCaptureSize() != 0) {
            classBuffer.appendNewLine();
            classBuffer.append("private:");
        }

        boolean first = true;
        boolean ctorRequired = false;
        List<LambdaCapture> captures = lambda.getCaptures();
        for (int i = 0; i < captures.size(); i++) {
            LambdaCapture capture = captures.get(i);
            Expr captureInit = lambda.getCaptureInits().get(i);

            ctorRequired = true;

            if (!capture.capturesVariable() && !capture.capturesThis()) {
                if (!capture.capturesVLAType()) {
                    diagnostics().error(captureInit != null ? captureInit : lambda, "capture without a variable");
                }
                continue;
            }

            if (first) {
                first = false;
                classBuffer.appendNewLine();
            } else {
                ctor.append(", ");
                inits.append(", ");
            }

            VarDecl capturedVar = capture.getCapturedVar();
            Type varType = capture.capturesThis() ? captureInit.getType() : capturedVar.getType();
            String plainName = capture.capturesThis() ? "this" : capturedVar.getName();
            String varName = capture.capturesThis() ? "__" + plainName : plainName;

            classBuffer.append(captureTypeName(varType, plainName));
            ctor.append(captureTypeName(varType, "_" + plainName));

            if (capture.getKind() == LambdaCapture.Kind.BY_REF) {
                // a captured reference already carries its &, arrays use the reference declarator
                Type canonical = varType.getCanonicalType();
                if (!canonical.isReferenceType() && !canonical.isArrayType()) {
                    ctor.append('&');
                    classBuffer.append('&');
                }
            }

            // an init-capture [a = b[1]] is initialized from its own expression
            if (!capture.capturesThis() && capturedVar.hasInit() && capture.getKind() == LambdaCapture.Kind.BY_COPY) {
                OutputBuffer scratch = new OutputBuffer(out.getConfiguration());
                withBuffer(scratch).insertArg(captureInit);
                inits.append(scratch.getString());
            } else {
                inits.append(capture.getKind() == LambdaCapture.Kind.STAR_THIS ? "*" : "").append(plainName);
            }

            if (!varType.getCanonicalType().isArrayType()) {
                ctor.append(" _").append(plainName);
                classBuffer.appendNewLine(" ", varName, ";");
            } else {
                classBuffer.appendNewLine(';');
            }

            ctorInits.add((ctorInits.isEmpty() ? ": " : ", ") + varName + "{_" + plainName + "}");
        }

        ctor.append(')');
        inits.append('}');

        if (ctorRequired) {
            classBuffer.appendNewLine();
            classBuffer.appendNewLine(ctor.toString());
            for (String ctorInit : ctorInits) {
                classBuffer.appendNewLine(ctorInit);
            }
            classBuffer.appendNewLine("{}");
        }

        return inits.toString();
    }

    private String captureTypeName(Type type, String varName) {
        if (type.getCanonicalType().isArrayType()) {
            return getTypeNameAsParameter(new ReferenceType(type), varName);
        }
        return getName(type);
    }

    /**
     * One member of a closure class: the prototype of {@code decl} with the body of
     * {@code bodySource}. Closures inside the body are hoisted into the class itself.
     */
    private void insertMethod(OutputBuffer classBuffer, MethodDecl decl, MethodDecl bodySource) {
        classBuffer.append(decl.getAccess().withColon());

        if (decl.isConversion()) {
            classBuffer.appendNewLine("using retType = ", getName(decl.getReturnType()), ";");
        }

        classBuffer.append(context.getPrototypePrinter().getPrototype(decl, true));
        classBuffer.appendNewLine();

        CodeGenerator bodyGenerator = new LambdaCodeGenerator(classBuffer, new LambdaStack(), context);
        bodyGenerator.insertArg(bodySource.getBody());
        classBuffer.appendNewLine();
    }

    // ---------------------------------------------------------------- declarations

    @Override
    public void visit(VarDecl n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.VAR_DECL)) {
            if (isNonTrivialStaticLocal(n)) {
                handleLocalStaticNonTrivialClass(n);
                return;
            }

            out.append(getQualifiers(n));

            Type type = n.getType();
            if (type.isFunctionPointerType()) {
                String funcPtrName = NameUtils.buildFunctionPointerAliasName(n);
                out.appendNewLine("using ", funcPtrName, " = ", getName(type), ";");
                out.append(funcPtrName, " ", n.getName());
            } else {
                out.append(getTypeNameAsParameter(type, n.getName()));
            }

            if (n.hasInit()) {
                out.append(" = ");
                insertArg(n.getInit());
            }

            if (n.isNRVOVariable()) {
                out.append(" /* NRVO variable */");
            }

            out.appendSemiNewLine();
        }
    }

    private static String getQualifiers(VarDecl n) {
        StringBuilder qualifiers = new StringBuilder();
        if (n.isInline()) {
            qualifiers.append("inline ");
        }
        if (n.getStorageClass() == StorageClass.EXTERN) {
            qualifiers.append("extern ");
        }
        if (n.getStorageClass() == StorageClass.STATIC) {
            qualifiers.append("static ");
        }
        if (n.isConstexpr()) {
            qualifiers.append("constexpr ");
        }
        return qualifiers.toString();
    }

    protected static boolean isNonTrivialStaticLocal(VarDecl n) {
        Type canonical = n.getType().getCanonicalType();
        return n.isStaticLocal() && canonical.isRecordType() && !canonical.getAsRecordType().isTrivial();
    }

    /**
     * A function-local static of a class type with a non-trivial constructor or destructor, spelled
     * out as the guarded one-time initialization the compiler performs.
     */
    protected void handleLocalStaticNonTrivialClass(VarDecl n) {
        Type type = n.getType();
        String internalVarName = NameUtils.buildInternalVarName(n.getName());
        String guardName = NameUtils.buildGuardName(internalVarName);
        String typeName = getName(type);

        out.appendNewLine("static bool ", guardName, ";");
        out.appendNewLine("static char ", internalVarName, "[sizeof(", typeName, ")];");
        out.appendNewLine();

        out.appendNewLine("if( ! ", guardName, " )");
        out.openScope();

        out.append("new (&", internalVarName, ") ");
        if (!n.hasInit()) {
            out.append(typeName);
        } else if (printsOwnTypeName(n.getInit())) {
            insertArg(n.getInit());
        } else if (n.getInit().ignoreImplicit() instanceof InitListExpr) {
            out.append(typeName);
            insertArg(n.getInit());
        } else {
            out.append(typeName, "(");
            insertArg(n.getInit());
            out.append(")");
        }
        out.appendSemiNewLine();

        out.appendNewLine(guardName, " = true;");
        out.closeScope();
        out.appendNewLine();
        out.appendNewLine();

        out.appendNewLine(getTypeNameAsParameter(new ReferenceType(type), n.getName()),
                          " = *reinterpret_cast<", getName(new PointerType(type)), ">(", internalVarName, ");");
    }

    /**
     * Whether the initializer already starts with the type it constructs.
     */
    private static boolean printsOwnTypeName(Expr init) {
        Expr e = init.ignoreImplicit();
        return e instanceof ConstructExpr || e instanceof FunctionalCastExpr || e instanceof StdInitializerListExpr;
    }

    @Override
    public void visit(ParmVarDecl n, Void arg) {
        out.append(getTypeNameAsParameter(n.getType(), n.getName()));
        if (n.hasInit()) {
            out.append(" = ");
            insertArg(n.getInit());
        }
    }

    @Override
    public void visit(DecompositionDecl n, Void arg) {
        try (LambdaScope scope = pushLambdaScope(LambdaCallerType.VAR_DECL)) {
            lowerDecomposition(n);
        }
    }

    /**
     * {@code auto [a, b] = e;} becomes a hidden object initialized from {@code e} and one reference
     * per binding into that object.
     */
    private void lowerDecomposition(DecompositionDecl n) {
        DeclRefExpr declRef = DeclRefFinder.find(n.getInit());
        String baseVarName;
        if (declRef != null) {
            String name = declRef.getName();
            baseVarName = name.contains(OPERATOR) ? OPERATOR : name;
        } else {
            diagnostics().error(n, "no name found for the decomposed object");
            baseVarName = "";
        }

        String tmpVarName = declRef != null
                            ? NameUtils.buildInternalVarName(baseVarName, n)
                            : NameUtils.buildInternalVarName(baseVarName);

        out.append(getTypeNameAsParameter(n.getType(), tmpVarName), " = ");
        insertArg(n.getInit());
        out.appendSemiNewLine();

        boolean isRefToObject = n.getType().getCanonicalType().isLValueReferenceType();

        for (BindingDecl bindingDecl : n.getBindings()) {
            Expr binding = bindingDecl.getBinding();
            if (binding == null) {
                continue;
            }

            Expr holdingVarOrMemberExpr;
            if (bindingDecl.getHoldingVar() != null) {
                holdingVarOrMemberExpr = bindingDecl.getHoldingVar().getInit();
            } else {
                holdingVarOrMemberExpr = binding instanceof MemberExpr ? binding : null;
            }

            boolean isArrayBinding = binding instanceof ArraySubscriptExpr && isRefToObject;
            boolean isNotTemporary = holdingVarOrMemberExpr != null && !(holdingVarOrMemberExpr instanceof ExprWithCleanups);
            String ref = isArrayBinding || isNotTemporary ? "&" : "";

            out.append(getName(bindingDecl.getType()), ref, " ", bindingDecl.getName(), " = ");

            if (holdingVarOrMemberExpr != null) {
                new StructuredBindingsCodeGenerator(out, lambdaStack, context, tmpVarName).insertArg(holdingVarOrMemberExpr);
            } else if (binding instanceof ArraySubscriptExpr) {
                out.append(tmpVarName);
                insertArg(binding);
            } else {
                insertPlaceholder(bindingDecl);
            }

            out.appendSemiNewLine();
        }
    }

    @Override
    public void visit(BindingDecl n, Void arg) {
        out.append(n.getName());
    }

    @Override
    public void visit(FieldDecl n, Void arg) {
        out.append(getTypeNameAsParameter(n.getType(), n.getName()));
        if (n.getInClassInitializer() != null) {
            out.append(" = ");
            insertArg(n.getInClassInitializer());
        }
        out.appendSemiNewLine();
    }

    @Override
    public void visit(FunctionDecl n, Void arg) {
        out.append(context.getPrototypePrinter().getPrototype(n));

        if (n.isDefaulted()) {
            out.appendNewLine(" = default;");
        } else if (n.isDeleted()) {
            out.appendNewLine(" = delete;");
        } else if (n.hasBody()) {
            out.appendNewLine();
            insertArg(n.getBody());
            out.appendNewLine();
        } else {
            out.appendSemiNewLine();
        }
        out.appendNewLine();
    }

    @Override
    public void visit(MethodDecl n, Void arg) {
        out.append(context.getPrototypePrinter().getPrototype(n));

        if (n.isDefaulted() || n.isDeleted()) {
            out.appendNewLine(n.isDefaulted() ? " = default;" : " = delete;");
            out.appendNewLine();
            return;
        }

        if (!n.isUserProvided() || !n.hasBody()) {
            out.appendSemiNewLine();
            out.appendNewLine();
            return;
        }

        boolean first = true;
        for (CtorInitializer init : n.getCtorInitializers()) {
            out.appendNewLine();
            out.append(first ? ": " : ", ");
            first = false;

            // base and delegating initializers have no member
            if (init.getMemberName() != null) {
                out.append(init.getMemberName());
                insertCurlysIfRequired(init.getInit());
            } else {
                insertArg(init.getInit());
            }
        }

        out.appendNewLine();
        insertArg(n.getBody());
        out.appendNewLine();
        out.appendNewLine();
    }

    @Override
    public void visit(AccessSpecDecl n, Void arg) {
        out.appendNewLine();
        out.appendNewLine(n.getAccess().getSpelling(), ":");
    }

    @Override
    public void visit(RecordDecl n, Void arg) {
        if (!n.hasDefinition()) {
            return;
        }

        out.append(n.getTagKind().getKeyword(), " ", n.getName());

        if (!n.getTemplateArgs().isEmpty()) {
            insertTemplateArgs(n.getTemplateArgs());
        }

        if (!n.getBases().isEmpty()) {
            out.append(" : ");
            boolean first = true;
            for (BaseSpecifier base : n.getBases()) {
                if (!first) {
                    out.append(", ");
                }
                first = false;
                out.append(base.getAccess().getSpelling(), base.isVirtual() ? " virtual " : " ", getName(base.getType()));
            }
        }

        out.appendNewLine();
        out.openScope();

        for (Decl decl : n.getDecls()) {
            insertArg(decl);
        }

        out.closeScopeWithSemi();
        out.appendNewLine();
        out.appendNewLine();
    }

    @Override
    public void visit(TypeAliasDecl n, Void arg) {
        out.appendNewLine("using ", n.getName(), " = ", getName(n.getUnderlyingType()), ";");
    }

    @Override
    public void visit(TypedefDecl n, Void arg) {
        // function pointer typedefs read better as aliases
        out.appendNewLine("using ", n.getName(), " = ", getName(n.getUnderlyingType()), ";");
    }

    @Override
    public void visit(UsingDecl n, Void arg) {
        out.appendNewLine("using ", n.getQualifier(), n.getName(), ";");
    }

    @Override
    public void visit(StaticAssertDecl n, Void arg) {
        out.append(n.isFailed() ? "/* FAILED: " : "/* PASSED: ", "static_assert(");
        insertArg(n.getAssertExpr());

        if (n.getMessage() != null) {
            out.append(", ");
            insertArg(n.getMessage());
        }

        out.appendNewLine("); */");
    }

    @Override
    public void visit(TranslationUnitDecl n, Void arg) {
        for (Decl decl : n.getDecls()) {
            insertArg(decl);
        }
    }

    @Override
    public void visit(UnsupportedDecl n, Void arg) {
        insertPlaceholder(n);
        out.appendNewLine();
    }

    // ---------------------------------------------------------------- template arguments

    /**
     * {@code <a, b>}; a space separates two closing angle brackets.
     */
    protected void insertTemplateArgs(List<TemplateArgument> args) {
        out.append('<');
        insertTemplateArgList(args);

        if (out.lastChar() == '>') {
            out.append(' ');
        }
        out.append('>');
    }

    protected void insertTemplateArgs(DeclRefExpr ref) {
        if (!ref.getTemplateArguments().isEmpty()) {
            out.append('<');
            insertTemplateArgList(ref.getTemplateArguments());
            out.append('>');
        }
    }

    private void insertTemplateArgList(List<TemplateArgument> args) {
        boolean first = true;
        for (TemplateArgument templateArg : args) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            insertTemplateArg(templateArg);
        }
    }

    protected void insertTemplateArg(TemplateArgument templateArg) {
        switch (templateArg.getKind()) {
            case TYPE:
            case NULLPTR:
                out.append(getName(templateArg.getAsType()));
                break;
            case DECLARATION:
                out.append("&", templateArg.getAsDeclaration().getName());
                break;
            case INTEGRAL:
                out.append(templateArg.getAsIntegral().toString());
                break;
            case EXPRESSION:
                insertArg(templateArg.getAsExpression());
                break;
            case PACK:
                insertTemplateArgList(templateArg.getPackElements());
                break;
            case TEMPLATE:
            case TEMPLATE_EXPANSION:
                out.append(templateArg.getAsTemplateName());
                break;
            case NULL:
            default:
                out.append("null");
                break;
        }
    }
}
