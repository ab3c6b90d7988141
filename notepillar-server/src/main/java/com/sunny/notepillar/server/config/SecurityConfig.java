package com.sunny.notepillar.server.config;

import java.util.Arrays;
import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import com.sunny.notepillar.server.filter.TraceIdFilter;
import com.sunny.notepillar.server.handler.SecurityExceptionHandler;

/**
 * 安全配置
 * 无状态过滤链，Bearer令牌校验由 MVC 拦截器完成
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final TraceIdFilter traceIdFilter;
    private final SecurityExceptionHandler securityExceptionHandler;
    private final NotepillarProperties properties;

    public SecurityConfig(TraceIdFilter traceIdFilter,
                          SecurityExceptionHandler securityExceptionHandler,
                          NotepillarProperties properties) {
        this.traceIdFilter = traceIdFilter;
        this.securityExceptionHandler = securityExceptionHandler;
        this.properties = properties;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        NotepillarProperties.Password.Argon2 argon2 = properties.getPassword().getArgon2();
        int memoryKb = Math.max(1, argon2.getMemoryMb()) * 1024;
        return new Argon2PasswordEncoder(
                argon2.getSaltLength(),
                argon2.getHashLength(),
                argon2.getParallelism(),
                memoryKb,
                argon2.getIterations()
        );
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                // Bearer 令牌不依赖浏览器自动携带，重认证 Cookie 为 SameSite=Strict
                .csrf(AbstractHttpConfigurer::disable)
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(exception -> exception
                        .authenticationEntryPoint(securityExceptionHandler)
                        .accessDeniedHandler(securityExceptionHandler))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/auth/**", "/session/**", "/notes", "/notes/**", "/error").permitAll()
                        .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .anyRequest().denyAll()
                )
                .addFilterBefore(traceIdFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        List<String> allowedOrigins = properties.getAllowedOrigins();
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = Arrays.asList("http://localhost:3000", "http://127.0.0.1:3000");
        }
        configuration.setAllowedOrigins(allowedOrigins);
        configuration.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        configuration.setAllowedHeaders(Arrays.asList("*"));
        configuration.setAllowCredentials(true);
        configuration.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
