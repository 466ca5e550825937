package com.sage.llm;

import com.sage.model.ModelTier;

import java.util.Objects;

/**
 * A configured model: its name at the backend, its tier and the client that reaches it.
 */
public final class ModelSpec {

    private final String name;
    private final ModelTier tier;
    private final ChatModelClient client;

    public ModelSpec(String name, ModelTier tier, ChatModelClient client) {
        this.name = Objects.requireNonNull(name, "name");
        this.tier = Objects.requireNonNull(tier, "tier");
        this.client = Objects.requireNonNull(client, "client");
    }

    public String getName() {
        return name;
    }

    public ModelTier getTier() {
        return tier;
    }

    public ChatModelClient getClient() {
        return client;
    }

    public boolean isAvailable() {
        try {
            return client.isAvailable(name);
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return name + "[" + tier.id() + "]";
    }
}
