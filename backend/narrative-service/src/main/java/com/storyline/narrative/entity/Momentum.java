package com.storyline.narrative.entity;

/**
 * Direction of coverage within the velocity window.
 */
public enum Momentum {
    GROWING,
    DECLINING,
    STABLE,
    UNKNOWN
}
