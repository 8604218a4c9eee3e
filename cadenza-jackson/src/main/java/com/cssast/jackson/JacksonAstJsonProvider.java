package com.cssast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.cssast.ast.AstNode;
import com.cssast.json.AstJsonDeserializer;
import com.cssast.json.AstJsonException;
import com.cssast.json.AstJsonProvider;
import com.cssast.json.AstJsonSerializer;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(CadenzaJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
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
        private final ObjectWriter nodeWriter;
        private final ObjectWriter forestWriter;

        JacksonSerializer(ObjectMapper mapper) {
            this.nodeWriter = mapper.writerFor(AstNode.class);
            this.forestWriter = mapper.writerFor(CadenzaJackson.FOREST);
        }

        @Override
        public String serialize(AstNode node) throws AstJsonException {
            try {
                return nodeWriter.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }

        @Override
        public String serializePretty(AstNode node) throws AstJsonException {
            try {
                return nodeWriter.withDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }

        @Override
        public String serializeForest(List<AstNode> ast) throws AstJsonException {
            try {
                return forestWriter.writeValueAsString(ast);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<AstNode> deserializeForest(String json) throws AstJsonException {
            try {
                // Walker replacement edits the list in place
                return new ArrayList<>(mapper.readValue(json, CadenzaJackson.FOREST));
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize AST", e);
            }
        }

        @Override
        public <T extends AstNode> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
