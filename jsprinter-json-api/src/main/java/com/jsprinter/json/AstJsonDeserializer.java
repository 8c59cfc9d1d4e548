package com.jsprinter.json;

import com.jsprinter.ast.Node;
import com.jsprinter.ast.Program;

/**
 * Reads parser output (ESTree, Babel or typescript-estree JSON) into AST records.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a parsed file. Accepts a {@code Program} root or Babel's {@code File}
     * wrapper around one.
     *
     * @param json the parser's JSON output
     * @return the program, with every comment of the file on {@link Program#comments()}
     * @throws AstJsonException if the JSON cannot be read
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Deserializes a single node, e.g. one {@code ImportDeclaration}.
     *
     * @param json the JSON of the node
     * @param type the expected node type
     * @param <T>  the node type
     * @return the deserialized node
     * @throws AstJsonException if the JSON cannot be read or is not a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
