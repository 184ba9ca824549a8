/**
 * 此文件集中处理网关HTTP接口抛出的异常。
 *
 * 主要职责:
 * - `ValidationFailureException` -> `422 Unprocessable Entity`，携带失败类别与原因。
 * - `GateNotInitializedException` -> `503 Service Unavailable`。
 * - 无法解析的请求体 -> `400 Bad Request`。
 *
 * 关联:
 * - `ValidationController`: 其抛出的异常在此被转换为 `ErrorResponse`。
 */
package club.agentgate.controller;

import club.agentgate.dto.ErrorResponse;
import club.agentgate.exception.GateNotInitializedException;
import club.agentgate.exception.ValidationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GateExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GateExceptionHandler.class);

    @ExceptionHandler(ValidationFailureException.class)
    public ResponseEntity<ErrorResponse> handleValidationFailure(ValidationFailureException ex) {
        var status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), ex.getKind().code(), ex.getDetail()));
    }

    @ExceptionHandler(GateNotInitializedException.class)
    public ResponseEntity<ErrorResponse> handleNotInitialized(GateNotInitializedException ex) {
        logger.error("请求在安全网关初始化之前到达: {}", ex.getMessage());
        var status = HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), "not_initialized", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        logger.warn("无法解析的请求体: {}", ex.getMostSpecificCause().getMessage());
        var status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), "malformed_request", "请求体不是有效的JSON。"));
    }
}
