package com.jsprinter.print;

import com.jsprinter.ast.Decorator;
import com.jsprinter.ast.DeclareExportAllDeclaration;
import com.jsprinter.ast.DeclareExportDeclaration;
import com.jsprinter.ast.Identifier;
import com.jsprinter.ast.ImportAttribute;
import com.jsprinter.ast.Literal;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.ModuleSpecifier;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.OpaqueNode;
import com.jsprinter.ast.Program;
import com.jsprinter.doc.Doc;

import java.util.List;

import static com.jsprinter.doc.Docs.EMPTY;
import static com.jsprinter.doc.Docs.concat;
import static com.jsprinter.doc.Docs.hardline;
import static com.jsprinter.doc.Docs.join;
import static com.jsprinter.doc.Docs.text;

/**
 * Default {@link PrintHooks}: prints the nodes of {@code com.jsprinter.ast} and copies
 * everything else ({@link OpaqueNode}) verbatim from the source.
 *
 * <p>One instance per file.</p>
 */
public final class EstreePrinter implements PrintHooks {

    private final PrintContext context;

    public EstreePrinter(SourceWindow source, PrintOptions options) {
        this.context = new PrintContext(source, options, this);
    }

    public PrintContext context() {
        return context;
    }

    @Override
    public Doc print(Node node) {
        if (node == null) {
            return EMPTY;
        }
        return CommentPrinter.printComments(node, printWithoutComments(node));
    }

    private Doc printWithoutComments(Node node) {
        if (node instanceof ModuleDeclaration declaration) {
            return ModuleDeclarationPrinter.print(declaration, context);
        } else if (node instanceof ModuleSpecifier specifier) {
            return SpecifierPrinter.print(specifier, this);
        } else if (node instanceof Identifier identifier) {
            return text(identifier.name());
        } else if (node instanceof Literal literal) {
            String raw = literal.rawText();
            return text(raw != null ? raw : context.source().text(literal));
        } else if (node instanceof ImportAttribute attribute) {
            return concat(print(attribute.key()), text(": "), print(attribute.value()));
        } else if (node instanceof OpaqueNode opaque) {
            return text(opaqueText(opaque));
        } else if (node instanceof Decorator) {
            return text(context.source().text(node));
        } else if (node instanceof Program) {
            throw new IllegalArgumentException("Programs are printed with ModulePrinter.printProgram");
        }
        throw new IllegalStateException("Unknown node " + node.type());
    }

    @Override
    public Doc printDecoratorsBeforeExport(ModuleDeclaration node) {
        if (!(node.declaration() instanceof OpaqueNode declaration)
            || !hasDecoratorsBeforeExport(node, declaration.decorators())) {
            return EMPTY;
        }
        List<Doc> decorators = declaration.decorators().stream().map(this::print).toList();
        return concat(join(hardline(), decorators), hardline());
    }

    /**
     * Babel starts both the export and the declaration at the first decorator, other
     * parsers start the export after its decorators.
     */
    private static boolean hasDecoratorsBeforeExport(ModuleDeclaration node, List<Decorator> decorators) {
        return decorators.stream().anyMatch(decorator -> decorator.start() <= node.start());
    }

    /**
     * The source of a node that is copied as is. A declaration whose span starts at its
     * decorators, as Babel writes {@code @dec export class A {}}, is cut after the
     * {@code export} and {@code default} keywords, which the export printer owns.
     */
    private String opaqueText(OpaqueNode node) {
        SourceWindow source = context.source();
        List<Decorator> decorators = node.decorators();
        if (decorators.isEmpty() || decorators.get(0).start() > node.start()) {
            return source.text(node);
        }
        int afterDecorators = decorators.get(decorators.size() - 1).end();
        String masked = source.maskedText(afterDecorators, node.end());
        int offset = skipKeyword(masked, skipWhitespace(masked, 0), "export");
        if (offset < 0) {
            return source.text(node);
        }
        int afterDefault = skipKeyword(masked, skipWhitespace(masked, offset), "default");
        if (afterDefault >= 0) {
            offset = afterDefault;
        }
        return source.slice(afterDecorators + skipWhitespace(masked, offset), node.end());
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Offset just past {@code keyword} if it is written at {@code from}, otherwise -1.
     */
    private static int skipKeyword(String text, int from, String keyword) {
        int end = from + keyword.length();
        if (!text.startsWith(keyword, from)
            || (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end)))) {
            return -1;
        }
        return end;
    }

    @Override
    public Doc printDeclareToken(ModuleDeclaration node) {
        // TypeScript keeps `declare` on the wrapped declaration, which prints it itself
        if (node instanceof DeclareExportDeclaration || node instanceof DeclareExportAllDeclaration) {
            return text("declare ");
        }
        return EMPTY;
    }
}
