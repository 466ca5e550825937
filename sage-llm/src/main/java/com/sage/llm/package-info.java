/**
 * Privacy-constrained model routing.
 * <p>
 * {@link com.sage.llm.ModelPreferenceTable} maps (privacy mode, complexity) to ordered tiers and is the single place
 * where cloud tiers are excluded under LOCAL_ONLY. {@link com.sage.llm.PrivacyRouter} is the only completion path:
 * it fails closed on non-compliant models, retries overloaded ones and falls back only along allowed edges.
 * Streaming goes through {@link com.sage.llm.TokenStream}, which always ends with DONE or ERROR.
 */
package com.sage.llm;
