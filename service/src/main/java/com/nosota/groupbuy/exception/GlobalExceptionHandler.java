package com.nosota.groupbuy.exception;

import com.nosota.groupbuy.dto.ErrorResponse;
import com.nosota.groupbuy.error.DeadlineViolationException;
import com.nosota.groupbuy.error.InsufficientFundsException;
import com.nosota.groupbuy.error.InvalidParametersException;
import com.nosota.groupbuy.error.NoRewardException;
import com.nosota.groupbuy.error.ServiceNotConfiguredException;
import com.nosota.groupbuy.error.StateConflictException;
import com.nosota.groupbuy.error.UnauthorizedException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidParametersException.class)
    public ResponseEntity<ErrorResponse> handleInvalidParameters(
            InvalidParametersException ex, HttpServletRequest request) {
        log.error("Invalid parameters [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Parameters", ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(
            UnauthorizedException ex, HttpServletRequest request) {
        log.error("Unauthorized caller [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<ErrorResponse> handleStateConflict(
            StateConflictException ex, HttpServletRequest request) {
        log.error("State conflict [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "State Conflict", ex.getMessage(), request);
    }

    @ExceptionHandler(DeadlineViolationException.class)
    public ResponseEntity<ErrorResponse> handleDeadlineViolation(
            DeadlineViolationException ex, HttpServletRequest request) {
        log.error("Deadline violation [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Deadline Violation", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(
            InsufficientFundsException ex, HttpServletRequest request) {
        log.error("Insufficient funds error [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.PAYMENT_REQUIRED, "Insufficient Funds", ex.getMessage(), request);
    }

    @ExceptionHandler(ServiceNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleServiceNotConfigured(
            ServiceNotConfiguredException ex, HttpServletRequest request) {
        log.error("Service not configured [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Not Configured", ex.getMessage(), request);
    }

    @ExceptionHandler(NoRewardException.class)
    public ResponseEntity<ErrorResponse> handleNoReward(
            NoRewardException ex, HttpServletRequest request) {
        log.error("No reward [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "No Reward", ex.getMessage(), request);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        log.error("Entity not found [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Entity Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.error("Validation failed [correlationId={}]: {}", MDC.get("correlationId"), message);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        log.error("Constraint violation [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex, HttpServletRequest request) {
        log.error("Malformed request [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getMessage(), request);
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorResponse> handleArithmetic(
            ArithmeticException ex, HttpServletRequest request) {
        log.error("Arithmetic overflow [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Amount Overflow", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.error("Illegal argument [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private static ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String error, String message, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
