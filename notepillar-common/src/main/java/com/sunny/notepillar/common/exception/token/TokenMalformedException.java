package com.sunny.notepillar.common.exception.token;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * Token格式非法或签名不匹配
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class TokenMalformedException extends UnauthorizedException {

    public TokenMalformedException(String message, Object... args) {
        super(ErrorType.TOKEN_MALFORMED, Map.of(), message, args);
    }

    public TokenMalformedException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.TOKEN_MALFORMED, Map.of(), message, args);
    }
}
