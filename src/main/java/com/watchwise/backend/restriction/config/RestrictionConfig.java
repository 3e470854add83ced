package com.watchwise.backend.restriction.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RestrictionProperties.class)
public class RestrictionConfig {}
