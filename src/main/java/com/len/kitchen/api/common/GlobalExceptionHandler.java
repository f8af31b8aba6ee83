package com.len.kitchen.api.common;

import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== 비즈니스 예외 (404/409/422/503 등) =====
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest request) {
        ErrorCode ec = e.getErrorCode();
        if (ec.getHttpStatus().is5xxServerError()) {
            log.error("[{}] {} {}", ec.getCode(), request.getMethod(), request.getRequestURI(), e);
        } else {
            log.warn("[{}] {} {} - {}", ec.getCode(), request.getMethod(), request.getRequestURI(), e.getMessage());
        }
        return respond(ec, e.getMessage(), request);
    }

    // ===== 요청 검증 실패 =====
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(ErrorCode.INVALID_REQUEST, message, request);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        return respond(ErrorCode.INVALID_REQUEST, ErrorCode.INVALID_REQUEST.getMessage(), request);
    }

    // ===== DB 관련 예외 =====
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest request) {
        log.error("[DB_ERROR] {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(ErrorCode.STORAGE_FAILURE, ErrorCode.STORAGE_FAILURE.getMessage(), request);
    }

    // ===== 그 외 모든 예외 =====
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e, HttpServletRequest request) {
        log.error("[INTERNAL_ERROR] {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode ec, String message, HttpServletRequest request) {
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, message, request.getRequestURI()));
    }
}
