package com.jsprinter.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.jsprinter.ast.DeclareExportAllDeclaration;
import com.jsprinter.ast.DeclareExportDeclaration;
import com.jsprinter.ast.Decorator;
import com.jsprinter.ast.ExportAllDeclaration;
import com.jsprinter.ast.ExportDefaultDeclaration;
import com.jsprinter.ast.ExportDefaultSpecifier;
import com.jsprinter.ast.ExportNamedDeclaration;
import com.jsprinter.ast.ExportNamespaceSpecifier;
import com.jsprinter.ast.ExportSpecifier;
import com.jsprinter.ast.Identifier;
import com.jsprinter.ast.ImportAttribute;
import com.jsprinter.ast.ImportDeclaration;
import com.jsprinter.ast.ImportDefaultSpecifier;
import com.jsprinter.ast.ImportNamespaceSpecifier;
import com.jsprinter.ast.ImportSpecifier;
import com.jsprinter.ast.Literal;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.OpaqueNode;
import com.jsprinter.ast.Program;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * Maps the parser's {@code type} names to node records. Every type without a record of
 * its own binds to {@link OpaqueNode}.
 */
public class NodeTypeIdResolver extends TypeIdResolverBase {

    private static final Map<String, Class<? extends Node>> NODE_TYPES = Map.ofEntries(
        Map.entry("Program", Program.class),
        Map.entry("ImportDeclaration", ImportDeclaration.class),
        Map.entry("ExportNamedDeclaration", ExportNamedDeclaration.class),
        Map.entry("ExportDefaultDeclaration", ExportDefaultDeclaration.class),
        Map.entry("ExportAllDeclaration", ExportAllDeclaration.class),
        Map.entry("DeclareExportDeclaration", DeclareExportDeclaration.class),
        Map.entry("DeclareExportAllDeclaration", DeclareExportAllDeclaration.class),
        Map.entry("ImportSpecifier", ImportSpecifier.class),
        Map.entry("ImportDefaultSpecifier", ImportDefaultSpecifier.class),
        Map.entry("ImportNamespaceSpecifier", ImportNamespaceSpecifier.class),
        Map.entry("ExportSpecifier", ExportSpecifier.class),
        Map.entry("ExportDefaultSpecifier", ExportDefaultSpecifier.class),
        Map.entry("ExportNamespaceSpecifier", ExportNamespaceSpecifier.class),
        Map.entry("Identifier", Identifier.class),
        Map.entry("Literal", Literal.class),
        Map.entry("StringLiteral", Literal.class),   // Babel
        Map.entry("ImportAttribute", ImportAttribute.class),
        Map.entry("Decorator", Decorator.class)
    );

    private JavaType baseType;

    static Collection<Class<? extends Node>> nodeClasses() {
        return NODE_TYPES.values();
    }

    @Override
    public void init(JavaType baseType) {
        this.baseType = baseType;
    }

    @Override
    public String idFromValue(Object value) {
        return ((Node) value).type();
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        return idFromValue(value);
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
        Class<? extends Node> type = NODE_TYPES.getOrDefault(id, OpaqueNode.class);
        if (!baseType.getRawClass().isAssignableFrom(type)) {
            JsonParser parser = context instanceof DeserializationContext deserialization
                ? deserialization.getParser()
                : null;
            throw InvalidTypeIdException.from(parser,
                "Node type '" + id + "' where a " + baseType.getRawClass().getSimpleName() + " is expected",
                baseType, id);
        }
        return context.constructSpecializedType(baseType, type);
    }

    @Override
    public String getDescForKnownTypeIds() {
        return String.join(", ", NODE_TYPES.keySet()) + " (any other type reads as OpaqueNode)";
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
