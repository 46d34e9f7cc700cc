package com.example.blogsync_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(BlogOptionsProperties.class)
public class AppPropertiesConfig {
}
