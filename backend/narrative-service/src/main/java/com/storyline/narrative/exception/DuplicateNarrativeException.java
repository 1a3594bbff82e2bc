package com.storyline.narrative.exception;

/**
 * 같은 creation key로 narrative가 이미 생성됨
 */
public class DuplicateNarrativeException extends NarrativeException {

    private final String creationKey;

    public DuplicateNarrativeException(String creationKey, Throwable cause) {
        super("DUPLICATE_NARRATIVE", "Narrative already exists for key: " + creationKey, null, cause);
        this.creationKey = creationKey;
    }

    public String getCreationKey() {
        return creationKey;
    }
}
