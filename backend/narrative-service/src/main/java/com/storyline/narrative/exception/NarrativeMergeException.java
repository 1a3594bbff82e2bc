package com.storyline.narrative.exception;

/**
 * narrative 병합 실패
 */
public class NarrativeMergeException extends NarrativeException {

    public NarrativeMergeException(String message, Long narrativeId) {
        super("MERGE_FAILED", message, narrativeId);
    }

    /**
     * 병합 대상이 이미 삭제됨
     */
    public static NarrativeMergeException vanished(Long narrativeId) {
        return new NarrativeMergeException("Narrative no longer exists: " + narrativeId, narrativeId);
    }

    public static NarrativeMergeException selfMerge(Long narrativeId) {
        return new NarrativeMergeException("Cannot merge narrative into itself: " + narrativeId, narrativeId);
    }
}
