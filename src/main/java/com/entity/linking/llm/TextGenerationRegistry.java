package com.entity.linking.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name to client map of the text generation providers an engine may use.
 * Populated once at construction and read-only afterwards, so it can be shared without locking.
 */
public final class TextGenerationRegistry {

    private final Map<String, TextGenerationClient> clients;

    private TextGenerationRegistry(Map<String, TextGenerationClient> clients) {
        this.clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    public static TextGenerationRegistry of(Map<String, TextGenerationClient> clients) {
        Objects.requireNonNull(clients, "clients is required");
        return new TextGenerationRegistry(clients);
    }

    public static TextGenerationRegistry empty() {
        return new TextGenerationRegistry(Map.of());
    }

    public Optional<TextGenerationClient> get(String name) {
        return Optional.ofNullable(clients.get(name));
    }

    /**
     * Registered names in registration order.
     */
    public List<String> names() {
        return List.copyOf(clients.keySet());
    }

    public boolean isEmpty() {
        return clients.isEmpty();
    }

    public int size() {
        return clients.size();
    }

    /**
     * Resolves the client to use for a call.
     *
     * @param name provider name, or null for the first registered provider
     * @throws IllegalArgumentException if a name is given but not registered
     * @throws IllegalStateException    if no provider is registered
     */
    public TextGenerationClient resolve(String name) {
        if (name != null) {
            TextGenerationClient client = clients.get(name);
            if (client == null) {
                throw new IllegalArgumentException("Unknown text generation provider: " + name +
                        " (available: " + clients.keySet() + ")");
            }
            return client;
        }
        if (clients.isEmpty()) {
            throw new IllegalStateException("No text generation providers available");
        }
        return clients.values().iterator().next();
    }
}
