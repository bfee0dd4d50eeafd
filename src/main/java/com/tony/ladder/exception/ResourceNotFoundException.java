package com.tony.ladder.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resourceType, Long id) {
        super(String.format("%s introuvable : %s", resourceType, id));
    }
}
