package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;

public abstract class Decl extends Node {

    protected Decl(Position begin) {
        super(begin);
    }
}
