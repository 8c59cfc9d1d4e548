package com.jsprinter.ast;

/**
 * One entry of an import or export specifier list.
 */
public sealed interface ModuleSpecifier extends Node permits
    ImportSpecifier,
    ImportDefaultSpecifier,
    ImportNamespaceSpecifier,
    ExportSpecifier,
    ExportDefaultSpecifier,
    ExportNamespaceSpecifier {

    /**
     * The specifier's own {@code importKind}/{@code exportKind}, as in
     * {@code import { type A } from "m"}; null when not written.
     */
    default String kind() {
        return null;
    }
}
