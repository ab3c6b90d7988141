package com.sunny.notepillar.common.exception.token;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * Token无效
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class TokenInvalidException extends UnauthorizedException {

    public TokenInvalidException(String message, Object... args) {
        super(ErrorType.TOKEN_INVALID, Map.of(), message, args);
    }

    public TokenInvalidException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.TOKEN_INVALID, Map.of(), message, args);
    }
}
