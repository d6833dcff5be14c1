package com.microsoft.cloudgovernance.api;

import com.microsoft.cloudgovernance.assessment.*;
import com.microsoft.cloudgovernance.licensing.Admission;
import com.microsoft.cloudgovernance.security.EnvironmentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps core exceptions to HTTP responses with a machine-readable "code".
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({EnvironmentNotFoundException.class, AssessmentNotFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(RuntimeException ex) {
        return body("NotFound", ex.getMessage());
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleAdmissionDenied(AdmissionDeniedException ex) {
        Admission admission = ex.getAdmission();
        Map<String, Object> body = body(admission.reasonCode(), ex.getMessage());
        body.put("currentUsage", admission.currentUsage());
        body.put("maxAllowed", admission.maxAllowed());
        return body;
    }

    @ExceptionHandler(AssessmentNotReadyException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleNotReady(AssessmentNotReadyException ex) {
        Map<String, Object> body = body("NotReady", ex.getMessage());
        body.put("assessmentId", ex.getAssessmentId());
        body.put("status", ex.getStatus());
        body.put("failureReason", ex.getFailureReason() != null ? ex.getFailureReason().getCode() : null);
        return body;
    }

    @ExceptionHandler(AssessmentStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleState(AssessmentStateException ex) {
        return body("InvalidState", ex.getMessage());
    }

    @ExceptionHandler(InvalidAssessmentRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(InvalidAssessmentRequestException ex) {
        return body("InvalidRequest", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body("InvalidRequest", message);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMalformed(Exception ex) {
        return body("InvalidRequest", "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(AuthenticationCredentialsNotFoundException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleUnauthenticated(AuthenticationCredentialsNotFoundException ex) {
        return body("Unauthenticated", ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleAccessDenied(AccessDeniedException ex) {
        return body("Forbidden", ex.getMessage());
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        return body;
    }
}
