package com.sage.llm;

import com.sage.model.ModelTier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Models configured for this process, in registration order.
 */
public final class ModelCatalog {

    private final List<ModelSpec> models = new CopyOnWriteArrayList<>();

    public ModelCatalog register(ModelSpec spec) {
        models.removeIf(m -> m.getName().equals(spec.getName()));
        models.add(spec);
        return this;
    }

    public List<ModelSpec> all() {
        return List.copyOf(models);
    }

    /** Models whose backend currently answers its availability check. */
    public List<ModelSpec> available() {
        return models.stream().filter(ModelSpec::isAvailable).collect(Collectors.toList());
    }

    public Optional<ModelSpec> find(String name) {
        if (name == null) return Optional.empty();
        return models.stream().filter(m -> m.getName().equals(name)).findFirst();
    }

    /** First available model of the tier not in {@code excluded}. */
    public Optional<ModelSpec> firstAvailable(ModelTier tier, Collection<String> excluded) {
        List<ModelSpec> candidates = new ArrayList<>();
        for (ModelSpec m : models) {
            if (m.getTier() == tier && (excluded == null || !excluded.contains(m.getName()))) candidates.add(m);
        }
        return candidates.stream().filter(ModelSpec::isAvailable).findFirst();
    }
}
