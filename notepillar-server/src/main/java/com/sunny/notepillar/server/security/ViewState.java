package com.sunny.notepillar.server.security;

/**
 * 界面视图状态
 * 随重认证Cookie跨会话保留
 *
 * @author Sunny
 * @date 2026-03-04
 */
public record ViewState(Long openNoteId, boolean createNoteInProgress) {

    public static ViewState empty() {
        return new ViewState(null, false);
    }
}
