package com.nosota.groupbuy.dto;

import org.slf4j.MDC;

import java.time.LocalDateTime;

/**
 * Error body returned by every failed REST call.
 *
 * @param timestamp     When the error was produced
 * @param status        HTTP status code
 * @param error         Short error title
 * @param message       Failure detail
 * @param path          Request URI
 * @param correlationId Request correlation id, for matching with service logs
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, MDC.get("correlationId"));
    }
}
