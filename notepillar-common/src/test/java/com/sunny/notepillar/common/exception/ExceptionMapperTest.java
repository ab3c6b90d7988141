package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.token.TokenExpiredException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExceptionMapperTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void resolve_shouldKeepTypedAuthenticationError() {
        MDC.put("traceId", "trace-1");

        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(new TokenExpiredException("Token已过期"));

        assertEquals(Code.UNAUTHORIZED, detail.httpStatus());
        assertEquals(ErrorType.TOKEN_EXPIRED, detail.type());
        assertEquals("trace-1", detail.traceId());
        assertFalse(detail.serverError());
    }

    @Test
    void resolve_shouldMarkProviderOutageRetryable() {
        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(
                new ServiceUnavailableException("翻译服务不可用"));

        assertEquals(Code.SERVICE_UNAVAILABLE, detail.httpStatus());
        assertTrue(detail.retryable());
        assertTrue(detail.serverError());
    }

    @Test
    void resolve_shouldHideUnknownExceptionMessage() {
        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(new IllegalStateException("db password leaked"));

        assertEquals(Code.INTERNAL_ERROR, detail.httpStatus());
        assertEquals("服务器内部错误", detail.message());
    }
}
