package org.desugar.printer;

import org.desugar.ast.decl.FunctionDecl;

/**
 * Formats the head of a function definition: specifiers, return type, name, parameter list and
 * trailing qualifiers. Access specifiers and bodies are not part of a prototype.
 */
public interface PrototypePrinter {

    /**
     * @param commentOutConstexpr print {@code constexpr} inside a comment, used for the members of
     *                            hoisted closure classes
     */
    String getPrototype(FunctionDecl decl, boolean commentOutConstexpr);

    default String getPrototype(FunctionDecl decl) {
        return getPrototype(decl, false);
    }
}
