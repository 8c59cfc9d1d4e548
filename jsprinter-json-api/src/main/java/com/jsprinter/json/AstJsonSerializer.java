package com.jsprinter.json;

import com.jsprinter.ast.Node;
import com.jsprinter.doc.Doc;

/**
 * Writes AST nodes and printed documents as JSON.
 */
public interface AstJsonSerializer {

    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a document in the formatter's doc JSON shape: strings for text, arrays
     * for concatenations, objects with a {@code type} for everything else.
     *
     * @param doc the printed document
     * @return the JSON form of the document
     * @throws AstJsonException if serialization fails
     */
    String serializeDoc(Doc doc) throws AstJsonException;
}
