/**
 * Search fan-out: {@link com.sage.search.SearchAggregator} queries ranked providers concurrently through their
 * gates; {@link com.sage.search.ProviderRanking} orders providers by learned effectiveness.
 */
package com.sage.search;
