package com.storyline.narrative.exception;

public class NarrativeNotFoundException extends NarrativeException {

    public NarrativeNotFoundException(Long narrativeId) {
        super("NARRATIVE_NOT_FOUND", "Narrative not found: " + narrativeId, narrativeId);
    }
}
