package com.sunny.notepillar.server.exception.security;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.InternalException;
import java.util.Map;

/**
 * 密码哈希格式非法异常
 * 存储的哈希不是合法的Argon2编码，属于配置或数据错误
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class PasswordHashInvalidException extends InternalException {

    public PasswordHashInvalidException(String message, Object... args) {
        super(ErrorType.PASSWORD_HASH_INVALID, Map.of(), message, args);
    }

    public PasswordHashInvalidException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.PASSWORD_HASH_INVALID, Map.of(), message, args);
    }
}
