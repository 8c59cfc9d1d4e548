package com.jsprinter.print;

import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.Node;
import com.jsprinter.doc.Doc;

/**
 * What the module declaration printer needs from the surrounding printer.
 *
 * @see EstreePrinter
 */
public interface PrintHooks {

    /**
     * Prints any child node (names, the source literal, attributes, specifiers, the wrapped
     * declaration) together with its attached comments.
     */
    Doc print(Node node);

    /**
     * Decorators written before {@code export}, as in {@code @dec export class A {}},
     * followed by a line break; empty when there are none.
     */
    Doc printDecoratorsBeforeExport(ModuleDeclaration node);

    /**
     * The {@code declare } token of an ambient export, or empty.
     */
    Doc printDeclareToken(ModuleDeclaration node);
}
