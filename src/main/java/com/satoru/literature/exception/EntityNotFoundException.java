package com.satoru.literature.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final Object entityId;

    public EntityNotFoundException(String entityName, Object entityId) {
        super(entityName + " not found: " + entityId);
        this.entityId = entityId;
    }
}
