package org.desugar.printer;

import org.desugar.ast.Node;
import org.desugar.ast.expr.ArrayInitLoopExpr;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitorWithDefaults;

/**
 * Finds the first name reference below a node, depth-first. The source of an array init loop is
 * looked through directly, its common expression hides the reference otherwise.
 */
class DeclRefFinder extends VoidVisitorWithDefaults<Void> {

    private DeclRefExpr found;

    static DeclRefExpr find(Node node) {
        if (node == null) {
            return null;
        }
        DeclRefFinder finder = new DeclRefFinder();
        node.accept(finder, null);
        return finder.found;
    }

    @Override
    public void defaultAction(Node n, Void arg) {
        for (Node child : n.getChildNodes()) {
            if (found != null) {
                return;
            }
            child.accept(this, arg);
        }
    }

    @Override
    public void visit(DeclRefExpr n, Void arg) {
        if (found == null) {
            found = n;
        }
    }

    @Override
    public void visit(ArrayInitLoopExpr n, Void arg) {
        Expr source = n.getCommonExpr().getSourceExpr();
        if (source instanceof DeclRefExpr) {
            visit((DeclRefExpr) source, arg);
            return;
        }
        defaultAction(n, arg);
    }
}
