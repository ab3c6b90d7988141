package com.sunny.notepillar.server.exception.security;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.InternalException;
import java.util.Map;

/**
 * 生产环境弱密钥异常
 * 仅在启动阶段抛出，导致进程拒绝启动
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class WeakProductionKeyException extends InternalException {

    public WeakProductionKeyException(String message, Object... args) {
        super(ErrorType.WEAK_PRODUCTION_KEY, Map.of(), message, args);
    }
}
