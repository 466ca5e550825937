package com.sage.llm;

import com.sage.model.PrivacyMode;

/** Advisory privacy mode with the reason for it. */
public record PrivacyAdvice(PrivacyMode mode, String reasoning) {
}
