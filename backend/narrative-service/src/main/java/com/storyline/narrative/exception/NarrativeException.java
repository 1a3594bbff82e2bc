package com.storyline.narrative.exception;

/**
 * Narrative 엔진 예외 기본 클래스
 */
public class NarrativeException extends RuntimeException {

    private final String errorCode;
    private final Long narrativeId;

    public NarrativeException(String message) {
        super(message);
        this.errorCode = "NARRATIVE_ERROR";
        this.narrativeId = null;
    }

    public NarrativeException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "NARRATIVE_ERROR";
        this.narrativeId = null;
    }

    public NarrativeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.narrativeId = null;
    }

    public NarrativeException(String errorCode, String message, Long narrativeId) {
        super(message);
        this.errorCode = errorCode;
        this.narrativeId = narrativeId;
    }

    public NarrativeException(String errorCode, String message, Long narrativeId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.narrativeId = narrativeId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Long getNarrativeId() {
        return narrativeId;
    }
}
