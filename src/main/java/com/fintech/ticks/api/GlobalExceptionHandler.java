package com.fintech.ticks.api;

import com.fintech.ticks.service.WindowQueryService;
import com.fintech.ticks.symbol.UnknownSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownSymbolException.class)
    public ResponseEntity<ErrorResponse> handleUnknownSymbol(
            UnknownSymbolException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.NOT_FOUND.value(),
            "UNKNOWN_SYMBOL",
            ex.getMessage(),
            path
        );

        log.warn("Unknown symbol on {}: {}", path, ex.getSymbol());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle storage failures surfaced by the query service.
     */
    @ExceptionHandler(WindowQueryService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            WindowQueryService.ServiceException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "SERVICE_ERROR",
            ex.getMessage(),
            path
        );

        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "INVALID_ARGUMENT",
            ex.getMessage(),
            path
        );

        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.",
            path
        );

        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
