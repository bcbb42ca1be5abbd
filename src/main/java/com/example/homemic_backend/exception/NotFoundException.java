package com.example.homemic_backend.exception;

public class NotFoundException extends HomeMicException {

    private final String resource;

    public NotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
