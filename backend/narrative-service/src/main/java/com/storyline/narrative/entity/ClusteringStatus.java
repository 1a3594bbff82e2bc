package com.storyline.narrative.entity;

public enum ClusteringStatus {
    /** Waiting for the next narrative cycle */
    PENDING,
    /** Linked to a narrative */
    ASSIGNED,
    /** Empty or deny-listed nucleus, deny-listed source */
    EXCLUDED
}
