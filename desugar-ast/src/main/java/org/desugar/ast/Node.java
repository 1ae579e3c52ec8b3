package org.desugar.ast;

import com.github.javaparser.Position;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base class of every node in the resolved tree handed over by the front end.
 */
public abstract class Node {

    private final Position begin;

    protected Node(Position begin) {
        this.begin = begin;
    }

    /**
     * Where the node starts in the original source, when the front end knows it.
     */
    public Optional<Position> getBegin() {
        return Optional.ofNullable(begin);
    }

    /**
     * The children in source order.
     */
    public abstract List<Node> getChildNodes();

    public abstract <A> void accept(VoidVisitor<A> v, A arg);

    /**
     * Short description used in placeholders and diagnostics.
     */
    public String getKindName() {
        return getClass().getSimpleName();
    }

    protected static List<Node> childrenOf(Object... parts) {
        List<Node> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node) {
                children.add((Node) part);
            } else if (part instanceof Collection) {
                for (Object element : (Collection<?>) part) {
                    if (element instanceof Node) {
                        children.add((Node) element);
                    }
                }
            }
        }
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return getKindName() + getBegin().map(p -> " <" + p.line + ":" + p.column + ">").orElse("");
    }
}
