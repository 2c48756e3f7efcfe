package com.deepknow.goodface.coaching.config;

import com.deepknow.goodface.coaching.audio.AudioBufferPool;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.link.JdkLinkConnector;
import com.deepknow.goodface.coaching.link.LinkConnector;
import com.deepknow.goodface.coaching.session.CoachingSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(CoachingProperties.class)
public class CoachingConfig {
    private static final Logger log = LoggerFactory.getLogger(CoachingConfig.class);

    @Bean
    public AudioBufferPool audioBufferPool() {
        return new AudioBufferPool();
    }

    @Bean
    public LinkConnector linkConnector(AudioBufferPool audioBufferPool, CoachingProperties properties) {
        return new JdkLinkConnector(audioBufferPool, Duration.ofMillis(properties.getDeepgram().getConnectTimeoutMs()));
    }

    @Bean
    public Clock coachingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CoachingSessionConfig coachingSessionConfig(CoachingProperties properties) {
        CoachingSessionConfig config = properties.toSessionConfig();
        if (config.getApiKey() == null || config.getApiKey().isEmpty()) {
            log.warn("Deepgram API key not configured: set coaching.deepgram.api-key or env {}", properties.getDeepgram().getApiKeyEnv());
        }
        return config;
    }

    @Bean
    public CoachingSessionFactory coachingSessionFactory(CoachingSessionConfig coachingSessionConfig, LinkConnector linkConnector,
                                                         ObjectMapper objectMapper, Clock coachingClock) {
        return new CoachingSessionFactory(coachingSessionConfig, linkConnector, objectMapper, coachingClock);
    }
}
