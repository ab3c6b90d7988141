package com.sunny.notepillar.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Api响应模型
 * 成功响应统一包裹为 {code: 0, data}
 *
 * @author Sunny
 * @date 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private static final int SUCCESS_CODE = 0;

    private int code;
    private T data;
    private Integer limit;
    private Integer offset;

    public ApiResponse() {
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return buildSuccess(data, null, null);
    }

    public static ApiResponse<Void> ok() {
        return buildSuccess(null, null, null);
    }

    public static <T> ApiResponse<T> page(T data, int limit, int offset) {
        return buildSuccess(data, limit, offset);
    }

    private static <T> ApiResponse<T> buildSuccess(T data, Integer limit, Integer offset) {
        ApiResponse<T> response = new ApiResponse<>();
        response.code = SUCCESS_CODE;
        response.data = data;
        response.limit = limit;
        response.offset = offset;
        return response;
    }
}
