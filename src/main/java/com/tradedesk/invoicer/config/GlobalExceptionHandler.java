package com.tradedesk.invoicer.config;

import com.tradedesk.invoicer.dto.ApiErrorResponse;
import com.tradedesk.invoicer.exception.InvoicingException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvoicingException.class)
    public ResponseEntity<ApiErrorResponse> handleInvoicing(InvoicingException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            logger.error("{} on {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            logger.warn("{} on {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage());
        }
        return buildError(status, ex.getCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleConcurrency(ConcurrencyFailureException ex,
            HttpServletRequest request) {
        logger.warn("Concurrent update on {}: {}", request.getRequestURI(), ex.getMessage());
        return buildError(HttpStatus.CONFLICT, "CONFLICT",
                "The product is being changed by another request, please try again", Map.of(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        String message = fields.isEmpty() ? "Invalid request" : String.join("; ",
                fields.values().stream().map(String::valueOf).toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION", message, fields, request);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class })
    public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex, HttpServletRequest request) {
        logger.debug("Malformed request on {}: {}", request.getRequestURI(), ex.getMessage());
        return buildError(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                "Request could not be read. Check number formats and required fields.", Map.of(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnhandledException(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception on {}", request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Something went wrong. Please try again later.", Map.of(), request);
    }

    private static HttpStatus statusOf(InvoicingException ex) {
        ResponseStatus annotation = AnnotatedElementUtils.findMergedAnnotation(ex.getClass(), ResponseStatus.class);
        return annotation != null ? annotation.code() : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ApiErrorResponse> buildError(HttpStatus status, String code, String message,
            Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(response);
    }
}
