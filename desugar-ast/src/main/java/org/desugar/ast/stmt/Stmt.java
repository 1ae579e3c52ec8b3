package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;

public abstract class Stmt extends Node {

    protected Stmt(Position begin) {
        super(begin);
    }
}
