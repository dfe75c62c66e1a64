package com.cipherline.keycache;

import java.util.List;

/**
 * Outcome of one {@link KeyCache#prefetch(java.util.Collection)} call.
 *
 * @param fetched       ids resolved from the directory during this call
 * @param alreadyCached ids found in memory or persisted storage
 * @param skipped       ids suppressed by the negative cache; no request was made
 * @param notFound      ids the directory answered 404 for; now negatively cached
 * @param failed        ids that hit a transient or unexpected failure; not cached
 */
public record PrefetchReport(
        List<String> fetched,
        List<String> alreadyCached,
        List<String> skipped,
        List<String> notFound,
        List<String> failed
) {

    public int requested() {
        return fetched.size() + alreadyCached.size() + skipped.size() + notFound.size() + failed.size();
    }
}
