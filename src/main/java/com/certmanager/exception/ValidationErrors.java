package com.certmanager.exception;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ValidationErrors {

    private final List<FieldError> errors = new ArrayList<>();

    public ValidationErrors add(String field, String message) {
        errors.add(new FieldError(field, message));
        return this;
    }

    public ValidationErrors addAll(ValidationErrors other) {
        errors.addAll(other.errors);
        return this;
    }

    public boolean contains(String field) {
        return errors.stream().anyMatch(e -> e.getField().equals(field));
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public List<FieldError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public void throwIfAny() {
        if (!errors.isEmpty()) {
            throw new ValidationException(this);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (FieldError error : errors) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append('[').append(error.getField()).append("] ").append(error.getMessage());
        }
        return sb.toString();
    }

    @Data
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String message;
    }
}
