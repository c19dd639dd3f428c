package com.scholary.whisper.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.whisper.gateway.monitoring.WhisperClientMetrics;
import com.scholary.whisper.gateway.whisper.WhisperClient;
import com.scholary.whisper.gateway.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Whisper client.
 *
 * <p>The client is built here once per application context and injected wherever it is needed.
 * Spring closes it, and with it the backend connection, on shutdown.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {

  @Bean(destroyMethod = "close")
  public WhisperClient whisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    return new WhisperClient(properties, objectMapper);
  }

  @Bean
  public WhisperClientMetrics whisperClientMetrics(WhisperClient whisperClient) {
    return new WhisperClientMetrics(whisperClient.metrics());
  }
}
