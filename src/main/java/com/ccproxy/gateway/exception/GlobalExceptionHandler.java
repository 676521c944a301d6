package com.ccproxy.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ToolCallValidationException.class)
    public ResponseEntity<String> handleToolCall(ToolCallValidationException e) {
        log.warn("工具调用校验失败: {}", e.getMessage());
        JSONObject error = errorBody(e.getErrorType(), e.getMessage());
        error.put("tool_call", e.toJson());
        return buildErrorResponse(e.getStatusCode(), error);
    }

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<String> handleSchema(SchemaValidationException e) {
        log.warn("工具定义校验失败: {}", e.getMessage());
        JSONObject error = errorBody(e.getErrorType(), e.getMessage());
        error.put("tool_name", e.getToolName());
        error.put("field", e.getFieldPath());
        return buildErrorResponse(e.getStatusCode(), error);
    }

    @ExceptionHandler(ConversionFailedException.class)
    public ResponseEntity<String> handleConversion(ConversionFailedException e) {
        log.warn("格式转换失败 [{}]: {}", e.getPhase(), e.getMessage());
        JSONObject error = errorBody(e.getErrorType(), e.getMessage());
        error.put("phase", e.getPhase().name().toLowerCase());
        if (e.getCause() instanceof ToolCallValidationException toolError) {
            error.put("tool_call", toolError.toJson());
        }
        return buildErrorResponse(e.getStatusCode(), error);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<String> handleGateway(GatewayException e) {
        if (e.getStatusCode() >= 500) {
            log.error("网关异常: {}", e.getMessage(), e);
        } else {
            log.warn("请求无法处理: {}", e.getMessage());
        }
        return buildErrorResponse(e.getStatusCode(), errorBody(e.getErrorType(), e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        String errorType = statusCode == 404 ? "not_found_error" : "invalid_request_error";
        return buildErrorResponse(statusCode, errorBody(errorType, e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, errorBody("internal_error", "服务器内部错误"));
    }

    private static JSONObject errorBody(String errorType, String message) {
        return JSONObject.of("type", errorType, "message", message);
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, JSONObject error) {
        JSONObject body = JSONObject.of(
                "type", "error", //
                "error", error //
        );
        return ResponseEntity
                .status(HttpStatus.valueOf(Math.min(statusCode, 599)))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
