package com.proofly.backend.services.categorization;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts from joining AI results back onto transactions.
 * {@code unmatched} are results whose id did not belong to the submitted batch.
 */
public record MergeStats(int submitted, int returned, int updated, int unmatched, int skippedVerified) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("submitted", submitted);
        m.put("returned", returned);
        m.put("updated", updated);
        m.put("unmatched", unmatched);
        m.put("skipped_verified", skippedVerified);
        return m;
    }
}
