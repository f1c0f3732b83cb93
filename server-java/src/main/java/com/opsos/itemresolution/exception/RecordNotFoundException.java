package com.opsos.itemresolution.exception;

public class RecordNotFoundException extends ResolutionException {

    public RecordNotFoundException(String type, Long id) {
        super(type + " not found: " + id);
    }
}
