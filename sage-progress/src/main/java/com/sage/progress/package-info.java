/**
 * Session progress: snapshot broadcasting with replay for reconnecting clients, and an optional Redis sink.
 */
package com.sage.progress;
