package com.scholary.transcriber.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for task-related beans.
 *
 * <p>Enables the TaskProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(TaskProperties.class)
public class TaskConfig {}
