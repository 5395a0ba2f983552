package dev.maplecms.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final List<Locale> SUPPORTED_LOCALES = List.of(Locale.ENGLISH);

    private static final Pattern FILE_PATH_UNIX = Pattern.compile("/[a-zA-Z0-9_/.-]+\\.(java|class|jar)");
    private static final Pattern PACKAGE_REF = Pattern.compile("([a-z]+\\.)+[A-Z][a-zA-Z0-9]+");
    private static final Pattern SQL_KEYWORDS = Pattern.compile("(?i)(SELECT|INSERT|UPDATE|DELETE|FROM|WHERE|JOIN)\\s+");

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.NOT_FOUND, msg(locale, "error.not_found"), msg(locale, ex.getMessage()), exchange));
    }

    @ExceptionHandler(DuplicateResourceException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleDuplicateResource(DuplicateResourceException ex, ServerWebExchange exchange) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.CONFLICT, msg(locale, "error.conflict"), msg(locale, ex.getMessage()), exchange));
    }

    @ExceptionHandler(ReferentialViolationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleReferentialViolation(ReferentialViolationException ex, ServerWebExchange exchange) {
        log.warn("Referential violation: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.CONFLICT, msg(locale, "error.referential_violation"), ex.getMessage(), exchange));
    }

    // Unique violations that no service translated (e.g. a race on a name column)
    @ExceptionHandler(DataIntegrityViolationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex, ServerWebExchange exchange) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.CONFLICT, msg(locale, "error.conflict"), msg(locale, "error.constraint_violation"), exchange));
    }

    @ExceptionHandler(BadCredentialsException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleBadCredentials(BadCredentialsException ex, ServerWebExchange exchange) {
        log.warn("Authentication failed: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        String key = "error.account_disabled".equals(ex.getMessage()) ? ex.getMessage() : "error.invalid_credentials";
        return Mono.just(build(HttpStatus.UNAUTHORIZED, msg(locale, "error.unauthorized"), msg(locale, key), exchange));
    }

    @ExceptionHandler(SecurityException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleSecurityException(SecurityException ex, ServerWebExchange exchange) {
        log.warn("Security exception: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.UNAUTHORIZED, msg(locale, "error.unauthorized"), msg(locale, ex.getMessage()), exchange));
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleAccessDeniedException(AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.FORBIDDEN, msg(locale, "error.forbidden"), msg(locale, ex.getMessage()), exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : msg(locale, "error.invalid_value"),
                        (existing, ignored) -> existing
                ));

        log.warn("Validation failed: {}", errors);
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, msg(locale, "error.validation_failed"), msg(locale, "error.invalid_request_data"), exchange);
        body.setValidationErrors(errors);
        return Mono.just(body);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });

        Locale locale = resolveLocale(exchange);
        log.warn("Constraint violations: {}", errors);
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, msg(locale, "error.validation_failed"), msg(locale, "error.invalid_request_params"), exchange);
        body.setValidationErrors(errors);
        return Mono.just(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        // Try to resolve as i18n key first; fall back to sanitized message
        String translated = msg(locale, ex.getMessage());
        String safeMessage = translated.equals(ex.getMessage())
                ? sanitizeErrorMessage(ex.getMessage(), locale)
                : translated;
        return Mono.just(build(HttpStatus.BAD_REQUEST, msg(locale, "error.bad_request"), safeMessage, exchange));
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        String message = ex.getReason() != null ? ex.getReason() : msg(locale, "error.invalid_request");
        return Mono.just(build(HttpStatus.BAD_REQUEST, msg(locale, "error.bad_request"), message, exchange));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        Locale locale = resolveLocale(exchange);
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        String errorKey = statusToKey(status);
        String reason = ex.getReason();
        String translatedMessage = reason != null ? msg(locale, reason) : msg(locale, errorKey);
        return Mono.just(ResponseEntity.status(status)
                .body(build(status, msg(locale, errorKey), translatedMessage, exchange)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, msg(locale, "error.internal_server_error"), msg(locale, "error.unexpected_error"), exchange));
    }

    private ErrorResponse build(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }

    /**
     * Resolve locale from the Accept-Language header.
     */
    private Locale resolveLocale(ServerWebExchange exchange) {
        String acceptLanguage = exchange.getRequest().getHeaders().getFirst(HttpHeaders.ACCEPT_LANGUAGE);
        if (acceptLanguage != null && !acceptLanguage.isBlank()) {
            try {
                List<Locale.LanguageRange> ranges = Locale.LanguageRange.parse(acceptLanguage);
                Locale matched = Locale.lookup(ranges, SUPPORTED_LOCALES);
                if (matched != null) {
                    return matched;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Accept-Language header: {}", acceptLanguage);
            }
        }
        return Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        if (code == null) {
            return "";
        }
        return messageSource.getMessage(code, args, code, locale);
    }

    /**
     * Sanitize error messages to prevent leaking internal details.
     */
    private String sanitizeErrorMessage(String message, Locale locale) {
        if (message == null || message.isBlank()) {
            return msg(locale, "error.invalid_request");
        }

        String sanitized = FILE_PATH_UNIX.matcher(message).replaceAll("[path]");
        sanitized = PACKAGE_REF.matcher(sanitized).replaceAll("[class]");
        sanitized = SQL_KEYWORDS.matcher(sanitized).replaceAll("[query] ");

        if (sanitized.length() > 200) {
            sanitized = sanitized.substring(0, 200) + "...";
        }
        return sanitized;
    }

    private String statusToKey(HttpStatus status) {
        switch (status) {
            case NOT_FOUND:
                return "error.not_found";
            case UNAUTHORIZED:
                return "error.unauthorized";
            case FORBIDDEN:
                return "error.forbidden";
            case CONFLICT:
                return "error.conflict";
            case BAD_REQUEST:
                return "error.bad_request";
            default:
                return "error.internal_server_error";
        }
    }
}
