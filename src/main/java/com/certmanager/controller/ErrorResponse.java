package com.certmanager.controller;

import com.certmanager.exception.ValidationErrors;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Collections;
import java.util.List;

@Data
@AllArgsConstructor
public class ErrorResponse {
    private int status;
    private String error;
    private String message;
    private List<ValidationErrors.FieldError> errors;

    public static ErrorResponse of(int status, String error, String message) {
        return new ErrorResponse(status, error, message, Collections.emptyList());
    }
}
