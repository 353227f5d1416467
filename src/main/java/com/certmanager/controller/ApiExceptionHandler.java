package com.certmanager.controller;

import com.certmanager.exception.AcmeProtocolException;
import com.certmanager.exception.AcmeTimeoutException;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.exception.PassphraseException;
import com.certmanager.exception.PemFormatException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), status.getReasonPhrase(),
                e.getMessage(), e.getErrors().getErrors()));
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RecordNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({PemFormatException.class, PassphraseException.class})
    public ResponseEntity<ErrorResponse> handleBadMaterial(CertificateManagementException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(AcmeTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleAcmeTimeout(AcmeTimeoutException e) {
        log.warn("ACME request timed out: {}", e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, e);
    }

    @ExceptionHandler(AcmeProtocolException.class)
    public ResponseEntity<ErrorResponse> handleAcme(AcmeProtocolException e) {
        log.error("ACME request failed: {}", e.getMessage(), e);
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(CertificateManagementException.class)
    public ResponseEntity<ErrorResponse> handleOther(CertificateManagementException e) {
        log.error("Certificate operation failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), status.getReasonPhrase(), e.getMessage()));
    }
}
