package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * Named entity found in collected content. Equality ignores name case.
 */
public final class Entity {

    private final String name;
    private final String type;

    @JsonCreator
    public Entity(@JsonProperty("name") String name, @JsonProperty("type") String type) {
        this.name = Objects.requireNonNull(name, "name").trim();
        this.type = type != null && !type.isBlank() ? type.trim().toUpperCase(Locale.ROOT) : "CONCEPT";
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    /** Key used for de-duplication: lower-cased name plus type. */
    public String key() {
        return name.toLowerCase(Locale.ROOT) + "|" + type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        return key().equals(((Entity) o).key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + type + ")";
    }
}
