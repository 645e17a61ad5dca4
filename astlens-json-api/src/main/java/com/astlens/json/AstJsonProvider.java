package com.astlens.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Entry point to a JSON codec for snapshots, node references and host messages.
 *
 * <p>Codecs register themselves under {@code META-INF/services/com.astlens.json.AstJsonProvider};
 * astlens-jackson is the bundled one. Explorer code asks for a provider instead of naming one:</p>
 * <pre>{@code
 * AstJsonDeserializer reader = AstJsonProvider.getProvider().getDeserializer();
 * Ast ast = reader.deserializeAst(text);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short codec name used for lookup, matched case-insensitively (e.g. "Jackson").
     */
    String getName();

    /**
     * Returns the first registered codec.
     *
     * @throws IllegalStateException if no codec is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No astlens JSON codec registered; put astlens-jackson on the classpath"));
    }

    /**
     * Returns the registered codec called {@code name}.
     *
     * @throws IllegalStateException if no registered codec has that name
     */
    static AstJsonProvider getProvider(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException(
            "No astlens JSON codec named '" + name + "' is registered"));
    }

    static Optional<AstJsonProvider> find(String name) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst();
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
