package com.taildeck.backend.global.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(AccessForbiddenException.class)
    public ResponseEntity<ProblemResponse> handleForbidden(AccessForbiddenException ex) {
        ProblemResponse body = ProblemResponse.of(ex.getDetailMessage(), ex.getAdditionalMessage(), ex.getCode())
                .withRequired(ex.getRequired())
                .withRequiredLevel(ex.getRequiredLevel());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<ProblemResponse> handleInvalidParameter(InvalidParameterException ex) {
        ProblemResponse body = ProblemResponse.of(ex.getDetailMessage(), ex.getCode())
                .withValidValues(ex.getValidValues());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(RetryableProblemException.class)
    public ResponseEntity<ProblemResponse> handleRetryable(RetryableProblemException ex) {
        ProblemResponse body = ProblemResponse.of(ex.getDetailMessage(), ex.getAdditionalMessage(), ex.getCode());
        return ResponseEntity.status(ex.getStatusCode())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblem(ProblemException ex) {
        ProblemResponse body = ProblemResponse.of(ex.getDetailMessage(), ex.getAdditionalMessage(), ex.getCode());
        return ResponseEntity.status(ex.getStatusCode()).body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        String code = ex.getReason() != null ? ex.getReason() : status.name();
        ProblemResponse body = ProblemResponse.of(status.getReasonPhrase(), code);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex) {
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String message = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : null;
        ProblemResponse body = ProblemResponse.of("Validation failed", message, "VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ProblemResponse body = ProblemResponse.of("Invalid request body", "VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        ProblemResponse body = ProblemResponse.of("Invalid " + ex.getName(), "VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        ProblemResponse body = ProblemResponse.of("Missing " + ex.getParameterName(), "VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemResponse> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ProblemResponse.of("Not found", "NOT_FOUND"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        ProblemResponse body = ProblemResponse.of("Internal server error", "INTERNAL_ERROR");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
