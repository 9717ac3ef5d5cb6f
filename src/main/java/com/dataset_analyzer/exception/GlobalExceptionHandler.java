package com.dataset_analyzer.exception;

import com.dataset_analyzer.dto.response.GenericResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Objects;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GenericResponse<Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        log.warn("⚠️ Validation failed: {}", ex.getMessage());

        String errorMessage = ex.getBindingResult()
                .getAllErrors()
                .stream()
                .map(DefaultMessageSourceResolvable::getDefaultMessage)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("Invalid input");

        return ResponseEntity
                .badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(GenericResponse.failure("VALIDATION_ERROR", errorMessage));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<GenericResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errorMessage = ex.getConstraintViolations()
                .stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining(", "));
        return new ResponseEntity<>(GenericResponse.failure("CONSTRAINT_VIOLATION", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GenericResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(GenericResponse.failure("MALFORMED_JSON", "Request body is invalid or malformed"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(EmptyDatasetException.class)
    public ResponseEntity<GenericResponse<Object>> handleEmptyDataset(EmptyDatasetException ex) {
        log.warn("Rejected empty dataset: {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("EMPTY_DATASET", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MalformedRowException.class)
    public ResponseEntity<GenericResponse<Object>> handleMalformedRow(MalformedRowException ex) {
        log.warn("Rejected dataset with malformed row {}: {}", ex.getRowIndex(), ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("MALFORMED_ROW", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RunCancelledException.class)
    public ResponseEntity<GenericResponse<Object>> handleRunCancelled(RunCancelledException ex) {
        return new ResponseEntity<>(GenericResponse.failure("RUN_CANCELLED", ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GenericResponse<Object>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure("INTERNAL_SERVER_ERROR", "Something went wrong. Please try again later."),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
