package com.jsprinter.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jsprinter.ast.Comment;
import com.jsprinter.ast.DeclareExportDeclaration;
import com.jsprinter.ast.Literal;
import com.jsprinter.ast.ModuleDeclaration;
import com.jsprinter.ast.ModuleSpecifier;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.OpaqueNode;
import com.jsprinter.doc.Doc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson module that binds parser JSON to the AST records and writes documents.
 *
 * This module handles:
 * - Polymorphic node types via the "type" property (NodeMixin, NodeTypeIdResolver)
 * - Parser dialects: typescript-estree "range", Babel's attached comment arrays,
 *   Flow's "default" flag, missing offsets
 * - JavaScript-compatible literal values when writing
 * - Document serialization (DocSerializer)
 */
public class AstModule extends SimpleModule {

    // Babel attaches comments under these keys; the records read a single "comments" list
    private static final Map<String, String> ATTACHED_COMMENTS = Map.of(
        "leadingComments", "leading",
        "trailingComments", "trailing",
        "innerComments", ""
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jsprinter", "jsprinter-jackson"));
        addSerializer(Doc.class, new DocSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(ModuleDeclaration.class, NodeMixin.class);
        context.setMixInAnnotations(ModuleSpecifier.class, NodeMixin.class);

        // Mixins on the interfaces are not always picked up by the records, so each
        // record gets one explicitly
        for (Class<? extends Node> type : NodeTypeIdResolver.nodeClasses()) {
            context.setMixInAnnotations(type, NodeMixin.class);
        }
        context.setMixInAnnotations(OpaqueNode.class, NodeMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(DeclareExportDeclaration.class, DeclareExportDeclarationMixin.class);
        context.setMixInAnnotations(Comment.class, CommentMixin.class);

        context.addBeanDeserializerModifier(new AstDeserializerModifier());
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "type", visible = true)
    @JsonTypeIdResolver(NodeTypeIdResolver.class)
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    private abstract static class LiteralMixin extends NodeMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        abstract Object value();

        @JsonIgnore
        abstract boolean isString();
    }

    // The parser's "default" is renamed on the way in, see AstNodeDeserializer
    private abstract static class DeclareExportDeclarationMixin extends NodeMixin {
        @JsonProperty("isDefault")
        abstract boolean isDefault();
    }

    private abstract static class CommentMixin {
        @JsonIgnore
        abstract boolean isBlock();

        @JsonIgnore
        abstract boolean isDangling();
    }

    // ==================== Deserializer Modifier ====================

    private static class AstDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                      BeanDescription beanDesc,
                                                      JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new AstNodeDeserializer(deserializer);
            }
            return deserializer;
        }
    }

    /**
     * Rewrites the whole JSON tree of the outermost node into the shape the records
     * expect, then binds it with the regular record deserializer.
     */
    private static class AstNodeDeserializer extends JsonDeserializer<Object> implements ResolvableDeserializer {
        // Nested nodes arrive already rewritten by the outermost call on this thread
        private static final ThreadLocal<Integer> DEPTH = ThreadLocal.withInitial(() -> 0);

        private final JsonDeserializer<?> delegate;

        AstNodeDeserializer(JsonDeserializer<?> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer resolvable) {
                resolvable.resolve(ctxt);
            }
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            int depth = DEPTH.get();
            JsonNode node = p.readValueAsTree();

            if (depth > 0) {
                JsonParser jp = node.traverse(p.getCodec());
                jp.nextToken();
                return delegate.deserialize(jp, ctxt);
            }

            resolveSharedComments(node);
            transformNode(node, true);

            DEPTH.set(depth + 1);
            try {
                JsonParser jp = node.traverse(p.getCodec());
                jp.nextToken();
                return delegate.deserialize(jp, ctxt);
            } finally {
                DEPTH.set(depth);
            }
        }

        /**
         * @param isAstNode whether this object is a node (the root, or any object with a "type")
         */
        private void transformNode(JsonNode node, boolean isAstNode) {
            if (node == null || !node.isObject()) {
                return;
            }
            ObjectNode objNode = (ObjectNode) node;

            if (isAstNode) {
                // typescript-estree: "range": [start, end]
                JsonNode range = objNode.get("range");
                if (range != null && range.isArray() && range.size() == 2) {
                    if (!objNode.has("start")) objNode.put("start", range.get(0).asInt());
                    if (!objNode.has("end")) objNode.put("end", range.get(1).asInt());
                }
                objNode.remove("range");
                objNode.remove("loc");
                if (!objNode.has("start")) objNode.put("start", 0);
                if (!objNode.has("end")) objNode.put("end", 0);

                String type = objNode.path("type").asText();
                if ("DeclareExportDeclaration".equals(type) && objNode.has("default")) {
                    objNode.set("isDefault", objNode.remove("default"));
                }
                // On Program, "comments" is the file's comment list, not attachment
                if (!"Program".equals(type)) {
                    mergeAttachedComments(objNode);
                }
            }

            objNode.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isObject()) {
                    transformNode(value, value.has("type"));
                } else if (value.isArray()) {
                    value.forEach(child -> transformNode(child, child.has("type")));
                }
            });
        }

        /**
         * Babel attaches a comment written between two siblings to both of them, as a
         * trailing comment of the first and a leading comment of the second. Only one copy
         * is kept: the trailing one when the comment starts on the line the first sibling
         * ends and the second sibling starts on a later line, the leading one otherwise.
         * Lines come from Babel's "loc", so this runs before "loc" is dropped.
         */
        private void resolveSharedComments(JsonNode root) {
            Map<String, List<Attachment>> byRange = new HashMap<>();
            collectAttachments(root, byRange);

            for (List<Attachment> attachments : byRange.values()) {
                Attachment trailing = findAttachment(attachments, "trailingComments");
                Attachment leading = findAttachment(attachments, "leadingComments");
                if (trailing == null || leading == null) {
                    continue;
                }
                String dropped = staysTrailing(trailing, leading) ? "leadingComments" : "trailingComments";
                for (Attachment attachment : attachments) {
                    if (attachment.key().equals(dropped)) {
                        attachment.detach();
                    }
                }
            }
        }

        private void collectAttachments(JsonNode node, Map<String, List<Attachment>> byRange) {
            if (node.isArray()) {
                node.forEach(child -> collectAttachments(child, byRange));
                return;
            }
            if (!node.isObject()) {
                return;
            }
            ObjectNode objNode = (ObjectNode) node;
            for (String key : List.of("leadingComments", "trailingComments")) {
                JsonNode attached = objNode.get(key);
                if (attached != null && attached.isArray()) {
                    for (JsonNode comment : attached) {
                        byRange.computeIfAbsent(rangeOf(comment), range -> new ArrayList<>())
                            .add(new Attachment(objNode, key, comment));
                    }
                }
            }
            objNode.fields().forEachRemaining(entry -> {
                if (!ATTACHED_COMMENTS.containsKey(entry.getKey())) {
                    collectAttachments(entry.getValue(), byRange);
                }
            });
        }

        private static Attachment findAttachment(List<Attachment> attachments, String key) {
            for (Attachment attachment : attachments) {
                if (attachment.key().equals(key)) {
                    return attachment;
                }
            }
            return null;
        }

        private static boolean staysTrailing(Attachment trailing, Attachment leading) {
            int commentStart = line(trailing.comment(), "start");
            int commentEnd = line(trailing.comment(), "end");
            int previousEnd = line(trailing.owner(), "end");
            int nextStart = line(leading.owner(), "start");
            if (commentStart < 0 || commentEnd < 0 || previousEnd < 0 || nextStart < 0) {
                return false;
            }
            return commentStart == previousEnd && nextStart > commentEnd;
        }

        private static int line(JsonNode node, String position) {
            return node.path("loc").path(position).path("line").asInt(-1);
        }

        private static String rangeOf(JsonNode comment) {
            return comment.path("start").asInt() + ":" + comment.path("end").asInt();
        }

        private record Attachment(ObjectNode owner, String key, JsonNode comment) {
            void detach() {
                ArrayNode attached = (ArrayNode) owner.get(key);
                String range = rangeOf(comment);
                for (int i = attached.size() - 1; i >= 0; i--) {
                    if (rangeOf(attached.get(i)).equals(range)) {
                        attached.remove(i);
                    }
                }
            }
        }

        private void mergeAttachedComments(ObjectNode objNode) {
            List<JsonNode> merged = new ArrayList<>();
            for (Map.Entry<String, String> key : ATTACHED_COMMENTS.entrySet()) {
                JsonNode attached = objNode.remove(key.getKey());
                if (attached == null || !attached.isArray()) {
                    continue;
                }
                for (JsonNode comment : attached) {
                    // Neighbours may still share one comment object; copy before flagging
                    ObjectNode copy = comment.deepCopy();
                    copy.put("leading", key.getValue().equals("leading"));
                    copy.put("trailing", key.getValue().equals("trailing"));
                    merged.add(copy);
                }
            }
            if (merged.isEmpty()) {
                return;
            }

            ArrayNode comments = objNode.has("comments") && objNode.get("comments").isArray()
                ? (ArrayNode) objNode.get("comments")
                : objNode.putArray("comments");
            merged.sort((a, b) -> Integer.compare(a.path("start").asInt(), b.path("start").asInt()));
            comments.addAll(merged);
        }
    }
}
