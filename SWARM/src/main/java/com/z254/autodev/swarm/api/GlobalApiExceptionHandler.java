package com.z254.autodev.swarm.api;

import com.z254.autodev.swarm.api.dto.ErrorResponse;
import com.z254.autodev.swarm.error.AllProvidersUnavailableException;
import com.z254.autodev.swarm.error.InvocationTimeoutException;
import com.z254.autodev.swarm.error.ProviderErrorException;
import com.z254.autodev.swarm.error.ResourceExhaustedException;
import com.z254.autodev.swarm.error.SwarmException;
import com.z254.autodev.swarm.error.TaskNotFoundException;
import com.z254.autodev.swarm.error.UnknownAgentTypeException;
import com.z254.autodev.swarm.error.UnknownProviderException;
import com.z254.autodev.swarm.error.UnknownSwarmException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Maps engine failures to HTTP statuses with a uniform error body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_MESSAGE_LENGTH = 300;

    private final Clock clock;

    public GlobalApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(SwarmException.class)
    public ResponseEntity<ErrorResponse> handleSwarmException(SwarmException ex, ServerWebExchange exchange) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                    ex.getErrorCode(), truncate(ex.getMessage()));
        } else {
            log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                    ex.getErrorCode(), truncate(ex.getMessage()));
        }
        return body(status, ex.getErrorCode(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException ex, ServerWebExchange exchange) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                "INVALID_REQUEST", truncate(message));
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, exchange);
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        String message = ex instanceof ServerWebInputException input && input.getReason() != null
                ? input.getReason()
                : ex.getMessage();
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                "INVALID_REQUEST", truncate(message));
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, ServerWebExchange exchange) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                "INTERNAL_ERROR", truncate(ex.getMessage()), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal error", exchange);
    }

    static HttpStatus statusFor(SwarmException ex) {
        if (ex instanceof UnknownSwarmException
                || ex instanceof TaskNotFoundException
                || ex instanceof UnknownAgentTypeException
                || ex instanceof UnknownProviderException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof ResourceExhaustedException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof ProviderErrorException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (ex instanceof AllProvidersUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (ex instanceof InvocationTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message,
                                               ServerWebExchange exchange) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .errorCode(code)
                .message(truncate(message))
                .path(resolvePath(exchange))
                .timestamp(clock.instant())
                .build());
    }

    private String resolvePath(ServerWebExchange exchange) {
        return exchange == null ? "-" : exchange.getRequest().getPath().value();
    }

    private String resolveMethod(ServerWebExchange exchange) {
        return exchange == null ? "-" : exchange.getRequest().getMethod().name();
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
