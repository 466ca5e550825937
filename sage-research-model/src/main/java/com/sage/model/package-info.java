/**
 * Research data model shared by every module: session state, provider results, facts, entities,
 * saturation metrics, model recommendations and progress/stream events.
 * <p>
 * All types are Jackson-serializable so state can be checkpointed and pushed to progress listeners.
 */
package com.sage.model;
