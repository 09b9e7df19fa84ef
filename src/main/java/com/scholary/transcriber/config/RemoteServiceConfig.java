package com.scholary.transcriber.config;

import com.scholary.transcriber.remote.RemoteServiceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the remote transcription service client.
 *
 * <p>Enables the RemoteServiceProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(RemoteServiceProperties.class)
public class RemoteServiceConfig {}
