package com.sunny.notepillar.server.config;

import java.util.List;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.sunny.notepillar.server.security.BearerAuthInterceptor;
import com.sunny.notepillar.server.security.CurrentIdentityArgumentResolver;

/**
 * WebMvc安全配置
 * 注册Bearer认证拦截器与当前身份参数解析器
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Configuration
public class WebMvcSecurityConfig implements WebMvcConfigurer {

    private final BearerAuthInterceptor bearerAuthInterceptor;
    private final CurrentIdentityArgumentResolver currentIdentityArgumentResolver;

    public WebMvcSecurityConfig(BearerAuthInterceptor bearerAuthInterceptor,
                                CurrentIdentityArgumentResolver currentIdentityArgumentResolver) {
        this.bearerAuthInterceptor = bearerAuthInterceptor;
        this.currentIdentityArgumentResolver = currentIdentityArgumentResolver;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(bearerAuthInterceptor)
                .addPathPatterns("/auth/me", "/notes", "/notes/**", "/session/view-state");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(currentIdentityArgumentResolver);
    }
}
