package com.watchwise.backend.reconcile.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReconcileProperties.class)
public class ReconcileConfig {}
