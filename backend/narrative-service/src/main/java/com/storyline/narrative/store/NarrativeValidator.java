package com.storyline.narrative.store;

import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.exception.FingerprintValidationException;
import com.storyline.narrative.exception.NarrativeException;

/**
 * Checks applied before any narrative is written.
 */
public final class NarrativeValidator {

    private NarrativeValidator() {
    }

    public static void validate(Narrative narrative) {
        if (narrative.getFingerprint() == null) {
            throw FingerprintValidationException.missing(narrative.getId());
        }
        if (!narrative.getFingerprint().isValid()
                || narrative.getNucleusEntity() == null
                || narrative.getNucleusEntity().isBlank()) {
            throw FingerprintValidationException.emptyNucleus(narrative.getId());
        }
        if (narrative.getFirstSeen() == null || narrative.getLastUpdated() == null
                || narrative.getFirstSeen().isAfter(narrative.getLastUpdated())) {
            throw FingerprintValidationException.timestampsReversed(narrative.getId());
        }
        if (narrative.getArticleCount() != narrative.getArticleIds().size()) {
            throw new NarrativeException("INVALID_NARRATIVE", "Article count " + narrative.getArticleCount()
                    + " does not match article ids " + narrative.getArticleIds().size()
                    + " for narrative " + narrative.getId(), narrative.getId());
        }
    }
}
