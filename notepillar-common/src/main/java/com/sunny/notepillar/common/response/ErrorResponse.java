package com.sunny.notepillar.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * 错误响应模型
 *
 * @author Sunny
 * @date 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private int code;
    private String type;
    private String message;
    private Map<String, String> context;
    private String traceId;
    private Boolean retryable;

    public ErrorResponse() {
    }

    public ErrorResponse(int code,
                         String type,
                         String message,
                         Map<String, String> context,
                         String traceId,
                         Boolean retryable) {
        this.code = code;
        this.type = type;
        this.message = message;
        this.context = context;
        this.traceId = traceId;
        this.retryable = retryable;
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public void setContext(Map<String, String> context) {
        this.context = context;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public Boolean getRetryable() {
        return retryable;
    }

    public void setRetryable(Boolean retryable) {
        this.retryable = retryable;
    }

    public static ErrorResponse of(int code, String type, String message, String traceId) {
        return new ErrorResponse(code, type, message, null, traceId, null);
    }

    public static ErrorResponse of(int code,
                                   String type,
                                   String message,
                                   Map<String, String> context,
                                   String traceId,
                                   boolean retryable) {
        return new ErrorResponse(code, type, message, context, traceId, retryable ? Boolean.TRUE : null);
    }
}
