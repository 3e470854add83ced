package com.watchwise.backend.pairing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PairingProperties.class)
public class PairingConfig {}
