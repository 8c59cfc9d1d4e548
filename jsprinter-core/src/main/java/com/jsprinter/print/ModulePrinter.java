package com.jsprinter.print;

import com.jsprinter.ast.Comment;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.Program;
import com.jsprinter.doc.Doc;

import java.util.List;

import static com.jsprinter.doc.Docs.EMPTY;
import static com.jsprinter.doc.Docs.concat;
import static com.jsprinter.doc.Docs.hardline;
import static com.jsprinter.doc.Docs.join;

/**
 * Entry points for printing with the default hooks.
 *
 * <pre>{@code
 * Doc doc = ModulePrinter.printDeclaration(node, sourceText, comments, PrintOptions.defaults());
 * }</pre>
 */
public final class ModulePrinter {

    private ModulePrinter() {
        // Utility class
    }

    public static Doc printDeclaration(ModuleDeclaration node, String sourceText,
                                       List<Comment> comments, PrintOptions options) {
        EstreePrinter printer = new EstreePrinter(new SourceWindow(sourceText, comments), options);
        return printer.print(node);
    }

    /**
     * Prints the top-level statements of a program one per line. Import and export
     * declarations are reprinted; other statements are copied from the source.
     */
    public static Doc printProgram(Program program, String sourceText, PrintOptions options) {
        if (program.body().isEmpty()) {
            return EMPTY;
        }
        EstreePrinter printer = new EstreePrinter(new SourceWindow(sourceText, program.comments()), options);
        List<Doc> statements = program.body().stream().map(printer::print).toList();
        return concat(join(hardline(), statements), hardline());
    }
}
