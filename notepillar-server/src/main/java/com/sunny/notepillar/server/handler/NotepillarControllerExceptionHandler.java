package com.sunny.notepillar.server.handler;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 笔记服务Controller异常处理器
 *
 * @author Sunny
 * @date 2026-03-06
 */
@RestControllerAdvice
public class NotepillarControllerExceptionHandler extends BaseControllerExceptionHandler {

    @Override
    protected String resolveDuplicateKeyMessage(DuplicateKeyException exception) {
        String message = exception.getMessage();
        if (message == null) {
            return "数据已存在";
        }
        if (message.contains("uk_users_username")) {
            return "用户名已存在";
        }
        if (message.contains("uk_users_email")) {
            return "邮箱已被注册";
        }
        return "数据已存在，请检查输入内容";
    }
}
