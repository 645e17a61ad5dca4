package com.astlens.jackson;

import com.astlens.ast.Ast;
import com.astlens.ast.NodeId;
import com.astlens.json.AstJsonDeserializer;
import com.astlens.json.AstJsonException;
import com.astlens.json.AstJsonProvider;
import com.astlens.json.AstJsonSerializer;
import com.astlens.protocol.HostMessage;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(AstLensJackson.createObjectMapper());
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
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Ast ast) throws AstJsonException {
            try {
                return mapper.writeValueAsString(ast);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST", e);
            }
        }

        @Override
        public String serializePretty(Ast ast) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(ast);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST", e);
            }
        }

        @Override
        public String serializeNodeId(NodeId id) throws AstJsonException {
            try {
                return mapper.writeValueAsString(id);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize node id " + id, e);
            }
        }

        @Override
        public String serializeMessage(HostMessage message) throws AstJsonException {
            try {
                return mapper.writerFor(HostMessage.class).writeValueAsString(message);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + message.type() + " message", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Ast deserializeAst(String json) throws AstJsonException {
            return read(json, Ast.class, "AST");
        }

        @Override
        public NodeId deserializeNodeId(String json) throws AstJsonException {
            return read(json, NodeId.class, "node id");
        }

        @Override
        public HostMessage deserializeMessage(String json) throws AstJsonException {
            return read(json, HostMessage.class, "message");
        }

        private <T> T read(String json, Class<T> type, String what) {
            if (json == null) {
                throw new AstJsonException("Failed to deserialize " + what + ": no input");
            }
            T value;
            try {
                value = mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + what, e);
            }
            if (value == null) {
                throw new AstJsonException("Failed to deserialize " + what + ": input is null");
            }
            return value;
        }
    }
}
