package com.sunny.notepillar.server.handler;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.sunny.notepillar.common.exception.AlreadyExistsException;
import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.common.exception.ExceptionMapper;
import com.sunny.notepillar.common.exception.NotepillarRuntimeException;
import com.sunny.notepillar.common.response.ErrorResponse;

import jakarta.servlet.http.HttpServletResponse;

/**
 * BaseController异常处理器
 * 负责将异常统一转换为错误响应，服务端错误记 error，其余记 warn
 *
 * @author Sunny
 * @date 2026-03-06
 */
public abstract class BaseControllerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BaseControllerExceptionHandler.class);

    @ExceptionHandler(NotepillarRuntimeException.class)
    public ErrorResponse handleNotepillarRuntimeException(NotepillarRuntimeException exception,
                                                          HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    @ExceptionHandler(BindException.class)
    public ErrorResponse handleValidationException(BindException exception, HttpServletResponse response) {
        Map<String, String> errors = new LinkedHashMap<>();
        exception.getBindingResult().getAllErrors()
                .forEach(error -> errors.put(resolveErrorKey(error), error.getDefaultMessage()));
        String message = errors.isEmpty() ? "参数验证失败" : errors.toString();
        return buildErrorResponse(new BadRequestException(exception, message), response);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ErrorResponse handleUnreadableRequest(Exception exception, HttpServletResponse response) {
        return buildErrorResponse(new BadRequestException(exception, "请求参数格式错误"), response);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ErrorResponse handleDuplicateKeyException(DuplicateKeyException exception, HttpServletResponse response) {
        return buildErrorResponse(new AlreadyExistsException(exception, resolveDuplicateKeyMessage(exception)), response);
    }

    @ExceptionHandler(Exception.class)
    public ErrorResponse handleException(Exception exception, HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    protected String resolveDuplicateKeyMessage(DuplicateKeyException exception) {
        return "数据已存在";
    }

    private String resolveErrorKey(ObjectError error) {
        if (error instanceof FieldError fieldError) {
            return fieldError.getField();
        }
        return error.getObjectName();
    }

    private ErrorResponse buildErrorResponse(Throwable throwable, HttpServletResponse response) {
        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(throwable);
        if (detail.serverError()) {
            log.error("服务异常: type={}, message={}", detail.type(), detail.message(), throwable);
        } else {
            log.warn("请求异常: type={}, message={}", detail.type(), detail.message());
        }

        response.setStatus(detail.httpStatus());
        return ErrorResponse.of(
                detail.httpStatus(),
                detail.type(),
                detail.message(),
                detail.context(),
                detail.traceId(),
                detail.retryable());
    }
}
