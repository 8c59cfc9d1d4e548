package com.jsprinter.print;

import com.jsprinter.ast.ExportDefaultSpecifier;
import com.jsprinter.ast.ExportNamespaceSpecifier;
import com.jsprinter.ast.ExportSpecifier;
import com.jsprinter.ast.ImportDefaultSpecifier;
import com.jsprinter.ast.ImportNamespaceSpecifier;
import com.jsprinter.ast.ImportSpecifier;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.Nodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a specifier list into the part printed bare and the part printed in braces.
 */
public final class SpecifierClassifier {

    /**
     * @param standalone default and namespace specifiers, in source order
     * @param grouped    named specifiers, in source order
     */
    public record Partition(List<Node> standalone, List<Node> grouped) {
        public Partition {
            standalone = List.copyOf(standalone);
            grouped = List.copyOf(grouped);
        }
    }

    private SpecifierClassifier() {
        // Utility class
    }

    /**
     * @throws UnexpectedNodeException if the list holds anything but a specifier
     */
    public static Partition partition(ModuleDeclaration declaration) {
        List<Node> standalone = new ArrayList<>();
        List<Node> grouped = new ArrayList<>();

        for (Node specifier : declaration.specifiers()) {
            if (specifier instanceof ImportDefaultSpecifier
                || specifier instanceof ImportNamespaceSpecifier
                || specifier instanceof ExportDefaultSpecifier
                || specifier instanceof ExportNamespaceSpecifier) {
                standalone.add(specifier);
            } else if (specifier instanceof ImportSpecifier
                || specifier instanceof ExportSpecifier) {
                grouped.add(specifier);
            } else {
                throw new UnexpectedNodeException(declaration, specifier, "specifier");
            }
        }
        return new Partition(standalone, grouped);
    }

    /**
     * Whether the braced block may spread over several lines. A lone named specifier
     * stays on the line, however long.
     */
    public static boolean canBreak(Partition partition, boolean anySpecifierHasComment) {
        return partition.grouped().size() > 1
            || !partition.standalone().isEmpty()
            || anySpecifierHasComment;
    }

    public static boolean anySpecifierHasComment(ModuleDeclaration declaration) {
        return declaration.specifiers().stream().anyMatch(Nodes::hasComment);
    }
}
