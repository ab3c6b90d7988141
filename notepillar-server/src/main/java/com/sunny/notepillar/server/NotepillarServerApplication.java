package com.sunny.notepillar.server;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 笔记服务启动类
 * 负责服务启动与基础组件装配
 *
 * @author Sunny
 * @date 2026-03-02
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@MapperScan("com.sunny.notepillar.server.mapper")
public class NotepillarServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(NotepillarServerApplication.class, args);
    }
}
