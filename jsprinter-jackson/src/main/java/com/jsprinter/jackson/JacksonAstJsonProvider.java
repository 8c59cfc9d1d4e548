package com.jsprinter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jsprinter.ast.Node;
import com.jsprinter.ast.Program;
import com.jsprinter.doc.Doc;
import com.jsprinter.json.AstJsonDeserializer;
import com.jsprinter.json.AstJsonException;
import com.jsprinter.json.AstJsonProvider;
import com.jsprinter.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = PrinterJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializeDoc(Doc doc) throws AstJsonException {
            try {
                return mapper.writeValueAsString(doc);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize document", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            try {
                return mapper.treeToValue(unwrapFile(mapper.readTree(json)), Program.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new AstJsonException("Failed to deserialize Program", e);
            }
        }

        /**
         * Babel wraps the program in a {@code File} node that holds the comment list.
         */
        private static JsonNode unwrapFile(JsonNode root) {
            if (!"File".equals(root.path("type").asText()) || !root.path("program").isObject()) {
                return root;
            }
            ObjectNode program = (ObjectNode) root.get("program");
            if (!program.has("comments") && root.has("comments")) {
                program.set("comments", root.get("comments"));
            }
            return program;
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
