package com.cssast.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.cssast.ast.AstNode;

import java.util.List;

/**
 * Factory for creating properly configured ObjectMapper instances for CSS tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CadenzaJackson.createObjectMapper();
 * String json = mapper.writerFor(CadenzaJackson.FOREST).writeValueAsString(ast);
 * List&lt;AstNode&gt; ast = mapper.readValue(json, CadenzaJackson.FOREST);
 * </pre>
 */
public final class CadenzaJackson {

    /**
     * Type of a top-level node list. Needed so element type information survives erasure.
     */
    public static final TypeReference<List<AstNode>> FOREST = new TypeReference<>() {};

    private CadenzaJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for CSS tree serialization/deserialization.
     *
     * The returned mapper:
     * - Writes and reads the node variant from the "kind" property
     * - Omits null declaration values, but always writes both sides of a mapping
     * - Ignores unknown properties during deserialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Exclude null values by default; mappings opt back in via AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
