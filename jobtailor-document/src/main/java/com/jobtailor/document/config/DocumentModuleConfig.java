package com.jobtailor.document.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 文档模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.jobtailor.document")
@EnableConfigurationProperties(DocumentProperties.class)
public class DocumentModuleConfig {
}
