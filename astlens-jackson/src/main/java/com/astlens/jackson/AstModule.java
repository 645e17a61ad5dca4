package com.astlens.jackson;

import com.astlens.ast.Ast;
import com.astlens.ast.AstNode;
import com.astlens.ast.FunctionDecl;
import com.astlens.ast.Missing;
import com.astlens.ast.ModuleDecl;
import com.astlens.ast.NodeId;
import com.astlens.ast.NodeKind;
import com.astlens.ast.ParameterDecl;
import com.astlens.ast.ProductTypeDecl;
import com.astlens.ast.SourcePosition;
import com.astlens.ast.SourceRange;
import com.astlens.ast.TranslationUnit;
import com.astlens.ast.UnrecognizedNode;
import com.astlens.protocol.HighlightFullDeclaration;
import com.astlens.protocol.HostMessage;
import com.astlens.protocol.OpenSourceFile;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.ResolvableSerializer;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson module that configures serialization/deserialization for the snapshot classes.
 *
 * This module handles:
 * - Nodes as single-key objects, {@code {"FunctionDecl": {...}}}, in both directions
 * - Unknown kind tags, which read as {@link UnrecognizedNode}
 * - The producer's legacy names ({@code base}, {@code modulesIds}, {@code nodes})
 * - Required fields of the snapshot, of source sites and of node references
 * - Outbound messages discriminated by their {@code type} property
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.astlens", "astlens-jackson"));
        addDeserializer(AstNode.class, new AstNodeDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Ast.class, AstMixin.class);
        context.setMixInAnnotations(NodeId.class, NodeIdMixin.class);
        context.setMixInAnnotations(SourceRange.class, SourceRangeMixin.class);
        context.setMixInAnnotations(SourcePosition.class, SourcePositionMixin.class);

        // Node payloads never carry their own tag; the wrapping key does
        context.setMixInAnnotations(Missing.class, NodePayloadMixin.class);
        context.setMixInAnnotations(FunctionDecl.class, NodePayloadMixin.class);
        context.setMixInAnnotations(ModuleDecl.class, NodePayloadMixin.class);
        context.setMixInAnnotations(TranslationUnit.class, NodePayloadMixin.class);
        context.setMixInAnnotations(ParameterDecl.class, NodePayloadMixin.class);
        context.setMixInAnnotations(UnrecognizedNode.class, NodePayloadMixin.class);
        context.setMixInAnnotations(ProductTypeDecl.class, ProductTypeDeclMixin.class);

        context.setMixInAnnotations(HostMessage.class, HostMessageMixin.class);
        context.setMixInAnnotations(OpenSourceFile.class, OpenSourceFileMixin.class);
        context.setMixInAnnotations(HighlightFullDeclaration.class, HighlightFullDeclarationMixin.class);

        context.addBeanSerializerModifier(new TaggedNodeSerializerModifier());
    }

    // ==================== Mixins ====================

    private abstract static class AstMixin {
        @JsonCreator
        AstMixin(
            @JsonProperty(value = "moduleIds", required = true) @JsonAlias("modulesIds") List<NodeId> moduleIds,
            @JsonProperty(value = "groups", required = true) @JsonAlias("nodes") List<List<AstNode>> groups) {
        }
    }

    private abstract static class NodeIdMixin {
        @JsonCreator
        NodeIdMixin(
            @JsonProperty(value = "group", required = true) @JsonAlias("base") int group,
            @JsonProperty(value = "offset", required = true) int offset) {
        }
    }

    private abstract static class SourceRangeMixin {
        @JsonCreator
        SourceRangeMixin(
            @JsonProperty(value = "start", required = true) SourcePosition start,
            @JsonProperty(value = "end", required = true) SourcePosition end,
            @JsonProperty(value = "fileUrl", required = true) String fileUrl) {
        }

        @JsonIgnore
        abstract String fileName();
    }

    private abstract static class SourcePositionMixin {
        @JsonCreator
        SourcePositionMixin(
            @JsonProperty(value = "line", required = true) int line,
            @JsonProperty(value = "column", required = true) int column) {
        }
    }

    private abstract static class NodePayloadMixin {
        @JsonIgnore
        abstract String kind();

        @JsonIgnore
        abstract NodeKind nodeKind();
    }

    private abstract static class ProductTypeDeclMixin extends NodePayloadMixin {
        @JsonCreator
        ProductTypeDeclMixin(
            @JsonProperty("name") String name,
            @JsonProperty("site") SourceRange site,
            @JsonProperty("identifierSite") SourceRange identifierSite) {
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = OpenSourceFile.class, name = HostMessage.OPEN_SOURCE_FILE),
        @JsonSubTypes.Type(value = HighlightFullDeclaration.class, name = HostMessage.HIGHLIGHT_FULL_DECLARATION)
    })
    private interface HostMessageMixin {
    }

    private abstract static class OpenSourceFileMixin {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        OpenSourceFileMixin(@JsonProperty(value = "fileUrl", required = true) String fileUrl) {
        }
    }

    private abstract static class HighlightFullDeclarationMixin {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        HighlightFullDeclarationMixin(@JsonProperty(value = "range", required = true) SourceRange range) {
        }
    }

    // ==================== Serialization ====================

    /**
     * Wraps the bean serializer of every node class so the payload is written under its kind tag.
     */
    private static class TaggedNodeSerializerModifier extends BeanSerializerModifier {
        @Override
        public JsonSerializer<?> modifySerializer(SerializationConfig config,
                                                  BeanDescription beanDesc,
                                                  JsonSerializer<?> serializer) {
            if (AstNode.class.isAssignableFrom(beanDesc.getBeanClass())) {
                @SuppressWarnings("unchecked")
                JsonSerializer<Object> payload = (JsonSerializer<Object>) serializer;
                return new TaggedNodeSerializer(payload);
            }
            return serializer;
        }
    }

    private static class TaggedNodeSerializer extends JsonSerializer<Object> implements ResolvableSerializer {
        private final JsonSerializer<Object> payload;

        TaggedNodeSerializer(JsonSerializer<Object> payload) {
            this.payload = payload;
        }

        @Override
        public void resolve(SerializerProvider provider) throws JsonMappingException {
            if (payload instanceof ResolvableSerializer resolvable) {
                resolvable.resolve(provider);
            }
        }

        @Override
        public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(((AstNode) value).kind());
            payload.serialize(value, gen, serializers);
            gen.writeEndObject();
        }
    }

    // ==================== Deserialization ====================

    /**
     * Reads a node from its single-key form and narrows on the key.
     */
    private static class AstNodeDeserializer extends JsonDeserializer<AstNode> {
        @Override
        public AstNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = ctxt.readTree(p);
            if (!tree.isObject() || tree.size() != 1) {
                return ctxt.reportInputMismatch(AstNode.class,
                    "Expected a node object with exactly one kind key, got: %s", describe(tree));
            }

            Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
            Map.Entry<String, JsonNode> entry = fields.next();
            String tag = entry.getKey();
            JsonNode payload = entry.getValue();
            if (!payload.isObject()) {
                return ctxt.reportInputMismatch(AstNode.class,
                    "Payload of '%s' must be an object, got: %s", tag, describe(payload));
            }

            return switch (NodeKind.fromTag(tag)) {
                case MISSING -> Missing.INSTANCE;
                case FUNCTION_DECL -> ctxt.readTreeAsValue(payload, FunctionDecl.class);
                case MODULE_DECL -> ctxt.readTreeAsValue(payload, ModuleDecl.class);
                case TRANSLATION_UNIT -> ctxt.readTreeAsValue(payload, TranslationUnit.class);
                case PRODUCT_TYPE_DECL -> ctxt.readTreeAsValue(payload, ProductTypeDecl.class);
                case PARAMETER_DECL -> ctxt.readTreeAsValue(payload, ParameterDecl.class);
                case UNRECOGNIZED -> new UnrecognizedNode(tag);
            };
        }

        private static String describe(JsonNode node) {
            if (node.isObject()) {
                return "object with " + node.size() + " keys";
            }
            return node.getNodeType().toString().toLowerCase();
        }
    }
}
