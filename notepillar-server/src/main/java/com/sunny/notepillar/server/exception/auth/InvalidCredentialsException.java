package com.sunny.notepillar.server.exception.auth;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * 凭证错误异常
 * 用户名不存在与密码错误不做区分
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class InvalidCredentialsException extends UnauthorizedException {

    public InvalidCredentialsException(String message, Object... args) {
        super(ErrorType.INVALID_CREDENTIALS, Map.of(), message, args);
    }
}
