package com.storyline.narrative.entity;

/**
 * What caused two narratives to be merged.
 */
public enum MergeTrigger {
    /** Periodic deduplication pass */
    DEDUP,
    /** Concurrent creation of the same narrative detected during a cycle */
    MATCHER
}
