package com.sage.progress;

import com.sage.model.ProgressSnapshot;

/**
 * Receives progress snapshots. Delivery is at-least-once, so a listener may see the same sequence number twice
 * and should display snapshots idempotently.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressSnapshot snapshot);
}
