package com.example.partyrooms.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    FeaturesProperties.class,
    RoomProperties.class,
    SessionProperties.class,
    PasswordProperties.class
})
public class FeaturesConfig { }
