package com.cssast.json;

import com.cssast.ast.AstNode;

import java.util.List;

/**
 * Interface for serializing CSS AST nodes, including their recorded mappings, to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a single node (and its subtree) to a JSON object.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(AstNode node) throws AstJsonException;

    /**
     * Serializes a single node to a pretty-printed JSON object.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(AstNode node) throws AstJsonException;

    /**
     * Serializes a forest of top-level nodes to a JSON array.
     *
     * @param ast the top-level nodes
     * @return the JSON array
     * @throws AstJsonException if serialization fails
     */
    String serializeForest(List<AstNode> ast) throws AstJsonException;
}
