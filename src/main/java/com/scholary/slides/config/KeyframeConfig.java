package com.scholary.slides.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for keyframe extraction beans.
 *
 * <p>Enables the KeyframeProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(KeyframeProperties.class)
public class KeyframeConfig {}
