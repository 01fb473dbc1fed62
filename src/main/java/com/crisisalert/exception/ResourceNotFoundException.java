package com.crisisalert.exception;

import java.util.Map;

/** Unknown alert id or user without stored preferences, reported as 404 by the REST layer. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " not found: " + identifier,
                Map.of("resource", resourceType, "id", String.valueOf(identifier)));
    }
}
