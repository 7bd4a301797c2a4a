package fr.imt.chronos.chronos.presentation.web;

import fr.imt.chronos.chronos.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Turns exceptions thrown by the @RestController classes into error envelopes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== Domain Exception Handlers =====

    @ExceptionHandler({JobNotFoundException.class, ExecutionNotFoundException.class})
    public ResponseEntity<HttpResponse<Void>> handleResourceNotFound(ChronosException ex) {
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidRecurrenceException.class)
    public ResponseEntity<HttpResponse<Void>> handleInvalidRecurrence(InvalidRecurrenceException ex) {
        log.warn("Invalid recurrence on field {}: {}", ex.getField(), ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DuplicateTriggerException.class)
    public ResponseEntity<HttpResponse<Void>> handleDuplicateTrigger(DuplicateTriggerException ex) {
        log.error("Duplicate trigger: {}", ex.getMessage(), ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.CONFLICT);
    }

    /**
     * Fallback handler for any ChronosException not handled above.
     */
    @ExceptionHandler(ChronosException.class)
    public ResponseEntity<HttpResponse<Void>> handleChronosException(ChronosException ex) {
        log.error("Chronos exception: {}", ex.getMessage(), ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // ===== Framework Exception Handlers =====

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<HttpResponse<Void>> handleNoResourceFoundException(NoResourceFoundException ex) {
        log.warn("No resource found: {}", ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error("Resource Not Found");
        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<HttpResponse<Void>> handleValidationErrors(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.error("Validation error: {}", errorMessage);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Validation Failed",
                errorMessage
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<HttpResponse<Void>> handleWrongHttpVerb(HttpRequestMethodNotSupportedException ex) {
        log.error("Wrong HTTP verb: {}", ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Method Not Allowed",
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles a missing or empty body, malformed JSON and unknown job types.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<HttpResponse<Void>> handleMalformedRequest(HttpMessageNotReadableException ex) {
        log.error("Malformed request: ", ex);

        HttpResponse<Void> errorResponse = HttpResponse.error("Bad Request");
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<HttpResponse<Void>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported Media Type: {}", ex.getContentType());

        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Unsupported Media Type",
                "API only accepts JSON. Please set 'Content-Type: application/json'"
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<HttpResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.error("Illegal argument exception: ", ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Invalid Request",
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<HttpResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: ", ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "An internal server error occurred",
                "Please contact support."
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

}
