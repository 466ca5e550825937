package com.sage.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.model.ModelTier;
import com.sage.model.PrivacyMode;
import com.sage.model.TaskComplexity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup table {@code (privacyMode, complexity) -> ordered model tiers}, loaded from {@code model-preferences.json}.
 * <p>
 * The LOCAL_ONLY guarantee lives here and only here: construction rejects any cloud tier listed under LOCAL_ONLY,
 * and {@link #preferences(PrivacyMode, TaskComplexity)} drops tiers the mode does not allow before returning.
 */
public final class ModelPreferenceTable {

    private static final Logger log = LoggerFactory.getLogger(ModelPreferenceTable.class);
    private static final String DEFAULT_RESOURCE = "model-preferences.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<PrivacyMode, Map<TaskComplexity, List<ModelTier>>> table;

    public ModelPreferenceTable(Map<PrivacyMode, Map<TaskComplexity, List<ModelTier>>> entries) {
        Map<PrivacyMode, Map<TaskComplexity, List<ModelTier>>> copy = new EnumMap<>(PrivacyMode.class);
        for (Map.Entry<PrivacyMode, Map<TaskComplexity, List<ModelTier>>> e : entries.entrySet()) {
            Map<TaskComplexity, List<ModelTier>> row = new EnumMap<>(TaskComplexity.class);
            for (Map.Entry<TaskComplexity, List<ModelTier>> cell : e.getValue().entrySet()) {
                for (ModelTier tier : cell.getValue()) {
                    if (!e.getKey().allows(tier)) {
                        throw new IllegalArgumentException("Tier " + tier.id() + " is not allowed under " + e.getKey()
                                + " (complexity " + cell.getKey() + ")");
                    }
                }
                row.put(cell.getKey(), List.copyOf(cell.getValue()));
            }
            copy.put(e.getKey(), Collections.unmodifiableMap(row));
        }
        this.table = Collections.unmodifiableMap(copy);
    }

    /** Loads the bundled {@code model-preferences.json}. */
    public static ModelPreferenceTable loadDefault() {
        try (InputStream in = ModelPreferenceTable.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Model preference resource not found: " + DEFAULT_RESOURCE);
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Model preference load failed: " + e.getMessage(), e);
        }
    }

    /**
     * Parses {@code {"LOCAL_ONLY": {"LOW": ["local-fast"], ...}, ...}}.
     */
    public static ModelPreferenceTable fromJson(String json) {
        Map<String, Map<String, List<String>>> raw;
        try {
            raw = MAPPER.readValue(json, new TypeReference<Map<String, Map<String, List<String>>>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid model preference JSON: " + e.getMessage(), e);
        }
        Map<PrivacyMode, Map<TaskComplexity, List<ModelTier>>> entries = new EnumMap<>(PrivacyMode.class);
        raw.forEach((mode, row) -> {
            Map<TaskComplexity, List<ModelTier>> parsed = new EnumMap<>(TaskComplexity.class);
            row.forEach((complexity, tiers) -> {
                List<ModelTier> list = new ArrayList<>();
                for (String t : tiers) list.add(ModelTier.fromId(t));
                parsed.put(TaskComplexity.valueOf(complexity.trim().toUpperCase(Locale.ROOT)), list);
            });
            entries.put(PrivacyMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)), parsed);
        });
        ModelPreferenceTable table = new ModelPreferenceTable(entries);
        log.debug("Loaded model preferences for modes {}", entries.keySet());
        return table;
    }

    /** Ordered tiers allowed for the mode; empty when the table has no entry. */
    public List<ModelTier> preferences(PrivacyMode mode, TaskComplexity complexity) {
        Map<TaskComplexity, List<ModelTier>> row = table.get(mode);
        List<ModelTier> tiers = row != null ? row.getOrDefault(complexity, List.of()) : List.of();
        List<ModelTier> allowed = new ArrayList<>(tiers.size());
        for (ModelTier tier : tiers) {
            if (mode.allows(tier)) allowed.add(tier);
        }
        return allowed;
    }
}
