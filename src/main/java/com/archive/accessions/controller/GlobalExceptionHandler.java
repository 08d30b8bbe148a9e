package com.archive.accessions.controller;

import com.archive.accessions.exception.ArtifactStoreException;
import com.archive.accessions.exception.EntityNotFoundException;
import com.archive.accessions.exception.SubjectsNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SubjectsNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUnknownSubjects(SubjectsNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        return error(message, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return error("Malformed request", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ArtifactStoreException.class)
    public ResponseEntity<ErrorResponse> handleStorage(ArtifactStoreException ex) {
        log.warn("Artifact store failure for {}: {}", ex.getKey(), ex.getMessage());
        return error("Archive file is unavailable", HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled request failure", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(body, status);
    }
}
