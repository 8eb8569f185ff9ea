package com.healthbud.evidence;

import java.util.List;

/**
 * Looks up supporting material for a symptom query.
 */
public interface EvidenceSearch {

    /**
     * @return trusted results, possibly empty; never throws
     */
    List<EvidenceSource> search(String query);

    static EvidenceSearch none() {
        return query -> List.of();
    }
}
