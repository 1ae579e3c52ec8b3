package org.desugar.ast.decl;

public enum StorageClass {
    NONE,
    STATIC,
    EXTERN
}
