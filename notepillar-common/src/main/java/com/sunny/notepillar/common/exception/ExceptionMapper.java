package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;
import org.slf4j.MDC;

/**
 * 异常映射器
 * 将任意异常解析为统一的错误明细
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class ExceptionMapper {

    private static final String DEFAULT_INTERNAL_MESSAGE = "服务器内部错误";
    private static final String TRACE_ID_KEY = "traceId";

    private ExceptionMapper() {
    }

    public static ExceptionDetail resolve(Throwable throwable) {
        Throwable target = throwable == null ? new InternalException(DEFAULT_INTERNAL_MESSAGE) : throwable;
        String traceId = MDC.get(TRACE_ID_KEY);

        if (target instanceof NotepillarRuntimeException runtimeException) {
            boolean serverError = runtimeException.getCode() >= Code.INTERNAL_ERROR;
            return new ExceptionDetail(
                    runtimeException.getCode(),
                    runtimeException.getType(),
                    resolveMessage(runtimeException, serverError),
                    runtimeException.getContext(),
                    traceId,
                    runtimeException.isRetryable(),
                    serverError);
        }
        if (target instanceof IllegalArgumentException) {
            return new ExceptionDetail(
                    Code.BAD_REQUEST,
                    ErrorType.BAD_REQUEST,
                    resolveMessage(target, false),
                    Map.of(),
                    traceId,
                    false,
                    false);
        }
        return new ExceptionDetail(
                Code.INTERNAL_ERROR,
                ErrorType.INTERNAL_ERROR,
                DEFAULT_INTERNAL_MESSAGE,
                Map.of(),
                traceId,
                false,
                true);
    }

    private static String resolveMessage(Throwable throwable, boolean serverError) {
        String message = throwable.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        Throwable cause = throwable.getCause();
        if (!serverError && cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            return cause.getMessage();
        }
        return DEFAULT_INTERNAL_MESSAGE;
    }

    public record ExceptionDetail(
            int httpStatus,
            String type,
            String message,
            Map<String, String> context,
            String traceId,
            boolean retryable,
            boolean serverError) {
    }
}
