package com.sunny.notepillar.server.security;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import com.sunny.notepillar.common.exception.UnauthorizedException;

/**
 * 当前身份参数解析器
 * 请求未经过认证拦截器时直接拒绝
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Component
public class CurrentIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentIdentity.class)
                && AuthenticatedIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        Object identity = webRequest.getAttribute(BearerAuthInterceptor.IDENTITY_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST);
        if (identity instanceof AuthenticatedIdentity authenticatedIdentity) {
            return authenticatedIdentity;
        }
        throw new UnauthorizedException("未认证");
    }
}
