package com.jsprinter.ast;

import java.util.List;

/**
 * Base interface for the ESTree AST nodes the printer reads.
 *
 * <p>{@code start} and {@code end} are offsets into the original source text,
 * counted the way JavaScript strings count (UTF-16 code units).</p>
 */
public sealed interface Node permits
    Program,
    ModuleDeclaration,
    ModuleSpecifier,
    Identifier,
    Literal,
    ImportAttribute,
    Decorator,
    OpaqueNode {

    String type();
    int start();
    int end();

    /**
     * Comments attached to this node by the comment-attachment pass.
     * For {@link Program} this is the file-wide comment list instead.
     */
    List<Comment> comments();
}
