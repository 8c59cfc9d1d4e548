package com.jsprinter.ast;

import java.util.List;

/**
 * The import and export statements, including Flow's {@code declare export} forms.
 * Absent fields answer an empty list or null.
 */
public sealed interface ModuleDeclaration extends Node permits
    ImportDeclaration,
    ExportNamedDeclaration,
    ExportDefaultDeclaration,
    ExportAllDeclaration,
    DeclareExportDeclaration,
    DeclareExportAllDeclaration {

    default List<Node> specifiers() {
        return List.of();
    }

    default Literal source() {
        return null;
    }

    /**
     * The wrapped class, function, variable or expression of {@code export <declaration>}.
     */
    default Node declaration() {
        return null;
    }

    /**
     * The alias of {@code export * as name from "mod"}.
     */
    default Node exported() {
        return null;
    }

    default List<ImportAttribute> attributes() {
        return List.of();
    }

    default List<ImportAttribute> assertions() {
        return List.of();
    }

    default Extra extra() {
        return null;
    }

    /**
     * {@code importKind} or {@code exportKind}: "value", "type", "typeof" or null.
     */
    String kind();

    default boolean defaultExport() {
        return false;
    }
}
