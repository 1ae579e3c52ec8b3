package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class StringLiteralExpr extends Expr {

    private final CharacterKind characterKind;
    private final String value;

    public StringLiteralExpr(Position begin, Type type, CharacterKind characterKind, String value) {
        super(begin, type);
        this.characterKind = characterKind;
        this.value = value;
    }

    public CharacterKind getCharacterKind() {
        return characterKind;
    }

    /**
     * The unescaped contents.
     */
    public String getValue() {
        return value;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
