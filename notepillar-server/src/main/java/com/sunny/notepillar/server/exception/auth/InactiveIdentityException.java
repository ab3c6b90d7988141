package com.sunny.notepillar.server.exception.auth;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * 身份已禁用异常
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class InactiveIdentityException extends UnauthorizedException {

    public InactiveIdentityException(String message, Object... args) {
        super(ErrorType.INACTIVE_IDENTITY, Map.of(), message, args);
    }
}
