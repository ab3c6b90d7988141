package com.sunny.notepillar.common.exception.token;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * Token已过期
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class TokenExpiredException extends UnauthorizedException {

    public TokenExpiredException(String message, Object... args) {
        super(ErrorType.TOKEN_EXPIRED, Map.of(), message, args);
    }

    public TokenExpiredException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.TOKEN_EXPIRED, Map.of(), message, args);
    }
}
