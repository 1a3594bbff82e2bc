package com.storyline.narrative.exception;

/**
 * 차단 목록에 포함된 nucleus
 */
public class DenyListedEntityException extends NarrativeException {

    private final String entity;

    public DenyListedEntityException(String entity) {
        super("DENY_LISTED_ENTITY", "Nucleus entity is deny-listed: " + entity);
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }
}
