package com.jsprinter.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read parser output into AST records and
 * write documents as JSON.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PrinterJackson.createObjectMapper();
 * ImportDeclaration node = mapper.readValue(json, ImportDeclaration.class);
 * String docJson = mapper.writeValueAsString(doc);
 * </pre>
 */
public final class PrinterJackson {

    private PrinterJackson() {
        // Utility class
    }

    /**
     * The returned mapper:
     * - Resolves node records from the "type" property (unknown types become OpaqueNode)
     * - Accepts ESTree, Babel and typescript-estree offsets and comment placement
     * - Skips properties the records do not model
     * - Leaves null fields out when writing
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Parsers emit far more than the printer reads
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
