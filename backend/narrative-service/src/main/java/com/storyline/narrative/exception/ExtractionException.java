package com.storyline.narrative.exception;

/**
 * 엔티티 추출 호출 실패
 */
public class ExtractionException extends NarrativeException {

    private final boolean rateLimited;

    public ExtractionException(String message, boolean rateLimited) {
        super("EXTRACTION_FAILED", message);
        this.rateLimited = rateLimited;
    }

    public ExtractionException(String message, Throwable cause) {
        super("EXTRACTION_FAILED", message, null, cause);
        this.rateLimited = false;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public static ExtractionException rateLimited(String articleId) {
        return new ExtractionException("Extraction rate limited for article: " + articleId, true);
    }

    public static ExtractionException unparseable(String articleId, Throwable cause) {
        return new ExtractionException("Could not parse extraction for article: " + articleId, cause);
    }
}
