package com.sage.llm;

import com.sage.model.ModelTier;

/** Completion text plus the model that actually produced it (after any fallback). */
public record Completion(String text, String model, ModelTier tier) {
}
