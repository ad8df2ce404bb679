package com.archiver.api.rest;

import com.archiver.core.exception.ArchiveFormatException;
import com.archiver.core.exception.ArchiverException;
import com.archiver.core.exception.MalformedRecordException;
import com.archiver.core.exception.NotFoundException;
import com.archiver.core.exception.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;

/**
 * Maps archiver errors to problem responses carrying the error code.
 */
@RestControllerAdvice(basePackageClasses = ApiExceptionHandler.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, "Archive not found", ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MalformedRecordException.class)
    public ResponseEntity<ProblemDetail> handleMalformed(MalformedRecordException ex, HttpServletRequest request) {
        log.warn("Rejected batch document: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed batch", ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
        String detail = ex.getMessage() == null || ex.getMessage().isBlank()
            ? "Request could not be processed"
            : ex.getMessage();
        log.warn("Invalid request: {} (path={})", detail, request.getRequestURI());
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", INVALID_REQUEST, detail, request);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        log.error("Archive store unavailable: {}", ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Archive store unavailable",
            ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ArchiveFormatException.class)
    public ResponseEntity<ProblemDetail> handleCorrupt(ArchiveFormatException ex, HttpServletRequest request) {
        log.error("Stored archive is unreadable: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Stored archive is unreadable",
            ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ArchiverException.class)
    public ResponseEntity<ProblemDetail> handleArchiver(ArchiverException ex, HttpServletRequest request) {
        log.error("Request failed: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Request failed",
            ex.getErrorCode(), ex.getMessage(), request);
    }

    private static ResponseEntity<ProblemDetail> problem(
            HttpStatus status, String title, String code, String detail, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("errorCode", code);
        problem.setProperty("timestamp", OffsetDateTime.now());
        problem.setProperty("path", request.getRequestURI());
        return ResponseEntity.status(status).body(problem);
    }
}
