/**
 * Saturation metrics and the debounced stop decision.
 */
package com.sage.saturation;
