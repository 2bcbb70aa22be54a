package com.replyfeed.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(FeedGeneratorProperties.class)
public class FeedGeneratorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
