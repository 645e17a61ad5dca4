package com.astlens.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for snapshot serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = AstLensJackson.createObjectMapper();
 * Ast ast = mapper.readValue(json, Ast.class);
 * String json = mapper.writeValueAsString(ast);
 * </pre>
 */
public final class AstLensJackson {

    private AstLensJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for snapshot serialization/deserialization.
     *
     * The returned mapper:
     * - Reads and writes nodes in their single-key tagged form
     * - Omits null values (absent labels, identifier sites)
     * - Ignores unknown properties, rejects trailing content after the top-level value
 * - Rejects fractional numbers where an integer (line, column, group, offset) is expected
     * - Writes payload-less nodes such as {@code missing} as empty objects
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        mapper.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
