package com.example.auth.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  AuthSecretProperties.class,
  AuthJwtProperties.class,
  AuthSignupProperties.class
})
public class AuthPropertiesConfig {}
