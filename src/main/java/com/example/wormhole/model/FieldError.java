package com.example.wormhole.model;

/**
 * Single validation failure on a submitted field.
 */
public record FieldError(String field, String message) {}
