package com.example.wormhole.service;

import com.example.wormhole.model.FieldError;

import java.util.List;

/**
 * A submission failed field validation; nothing was filed.
 */
public class SubmissionValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public SubmissionValidationException(List<FieldError> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> errors() {
        return errors;
    }
}
