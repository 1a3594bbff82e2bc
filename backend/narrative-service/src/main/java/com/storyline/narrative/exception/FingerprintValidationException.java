package com.storyline.narrative.exception;

/**
 * fingerprint 검증 실패
 */
public class FingerprintValidationException extends NarrativeException {

    public FingerprintValidationException(String message) {
        super("INVALID_FINGERPRINT", message);
    }

    public FingerprintValidationException(String message, Long narrativeId) {
        super("INVALID_FINGERPRINT", message, narrativeId);
    }

    public static FingerprintValidationException emptyNucleus() {
        return new FingerprintValidationException("Fingerprint requires a non-empty nucleus entity");
    }

    public static FingerprintValidationException emptyNucleus(Long narrativeId) {
        return new FingerprintValidationException(
                "Narrative has no nucleus entity: " + narrativeId, narrativeId);
    }

    public static FingerprintValidationException missing(Long narrativeId) {
        return new FingerprintValidationException("Narrative has no fingerprint: " + narrativeId, narrativeId);
    }

    public static FingerprintValidationException timestampsReversed(Long narrativeId) {
        return new FingerprintValidationException(
                "Narrative firstSeen is after lastUpdated: " + narrativeId, narrativeId);
    }
}
