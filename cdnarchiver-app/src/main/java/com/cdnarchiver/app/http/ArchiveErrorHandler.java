package com.cdnarchiver.app.http;

import com.cdnarchiver.common.errors.ArchiveErrorKind;
import com.cdnarchiver.common.errors.ArchiveException;
import com.cdnarchiver.common.errors.PolicyDeniedException;
import com.cdnarchiver.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.UncheckedIOException;

/**
 * Maps archiver failures to HTTP statuses and the {@link ApiError} envelope.
 */
@Slf4j
@RestControllerAdvice
public class ArchiveErrorHandler {

    static HttpStatus statusFor(ArchiveErrorKind kind) {
        return switch (kind) {
            case CONFIGURATION, STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
            case DISABLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case POLICY_DENIED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SIZE_LIMIT_UNCOMPRESSIBLE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case UPLOAD_FAILURE -> HttpStatus.BAD_GATEWAY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    @ExceptionHandler(ArchiveException.class)
    public ResponseEntity<ApiError> handleArchive(ArchiveException e) {
        HttpStatus status = statusFor(e.getKind());
        String message = ErrorUtils.formatErrorMessage(e);
        if (status.is5xxServerError()) {
            log.warn("Archive request failed ({}): {}", e.getKind().label(), message);
        }
        ApiError body = e instanceof PolicyDeniedException denied
                ? ApiError.of(e.getKind().label(), message, false, denied.getReasons())
                : ApiError.of(e.getKind().label(), message, e.isRetryable());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class })
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(ApiError.of("bad_request", ErrorUtils.formatErrorMessage(e), false));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiError.of("payload_too_large", ErrorUtils.formatErrorMessage(e), false));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ApiError> handleIo(UncheckedIOException e) {
        log.error("Local I/O failure while archiving: {}", ErrorUtils.formatErrorMessage(e));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("io", ErrorUtils.formatErrorMessage(e), true));
    }
}
