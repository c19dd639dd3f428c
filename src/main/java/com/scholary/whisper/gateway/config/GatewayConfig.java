package com.scholary.whisper.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Configuration for the HTTP side of the gateway.
 *
 * <p>Enables {@link GatewayProperties} and opens the API to browser clients from any origin.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig implements WebMvcConfigurer {

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/api/**")
        .allowedOrigins("*")
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("Content-Type", "Content-Length", "Accept-Encoding", "Authorization");
  }
}
