package com.cssast.json;

import com.cssast.ast.AstNode;

import java.util.List;

/**
 * Interface for deserializing CSS AST nodes from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON array of nodes.
     *
     * @param json the JSON array to deserialize
     * @return a mutable list of top-level nodes, ready to be walked or printed
     * @throws AstJsonException if deserialization fails
     */
    List<AstNode> deserializeForest(String json) throws AstJsonException;

    /**
     * Deserializes a JSON object to a specific node type.
     *
     * @param json the JSON object to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails or the node has another kind
     */
    <T extends AstNode> T deserialize(String json, Class<T> type) throws AstJsonException;
}
