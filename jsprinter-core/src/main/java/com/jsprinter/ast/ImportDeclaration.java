package com.jsprinter.ast;

import java.util.List;

public record ImportDeclaration(
    int start,
    int end,
    List<Node> specifiers,                // ImportSpecifier, ImportDefaultSpecifier, or ImportNamespaceSpecifier
    Literal source,                       // String literal for the module path
    List<ImportAttribute> attributes,     // with { type: 'json' }
    List<ImportAttribute> assertions,     // assert { type: 'json' }, the older spelling
    String importKind,                    // "value", "type", "typeof" or null
    boolean module,                       // import module x from "y"
    String phase,                         // "source" or "defer", null for a plain import
    Extra extra,
    List<Comment> comments
) implements ModuleDeclaration {
    public ImportDeclaration {
        specifiers = Nodes.listOf(specifiers);
        attributes = Nodes.listOf(attributes);
        assertions = Nodes.listOf(assertions);
        comments = Nodes.listOf(comments);
    }

    public ImportDeclaration(
        int start,
        int end,
        List<Node> specifiers,
        Literal source,
        List<ImportAttribute> attributes
    ) {
        this(start, end, specifiers, source, attributes, List.of(), null, false, null, null, List.of());
    }

    @Override
    public String kind() {
        return importKind;
    }

    @Override
    public String type() {
        return "ImportDeclaration";
    }
}
