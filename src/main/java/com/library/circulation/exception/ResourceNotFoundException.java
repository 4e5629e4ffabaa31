package com.library.circulation.exception;

public class ResourceNotFoundException extends CirculationException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(ErrorCode.NOT_FOUND, entityName + " not found with id " + id);
    }
}
