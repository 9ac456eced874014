package com.baykanat.calendar.domain.exception;

/** İstenen id'ye karşılık kayıt yok; 404. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, long id) {
        super(resource + " not found: " + id);
    }
}
