package com.example.partyrooms.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.*;

class WebSocketConfigTest {

    @Test
    void localhostOriginsAlsoAllowAnyPort() {
        assertThat(WebSocketConfig.originPatterns("http://localhost:3000"),
                contains("http://localhost:3000", "http://localhost:*", "http://127.0.0.1:*"));
    }

    @Test
    void publicOriginsAreKeptAsIs_duplicatesDropped() {
        List<String> patterns = WebSocketConfig.originPatterns(" https://party.example.org , https://party.example.org,");
        assertEquals(List.of("https://party.example.org"), patterns);
    }

    @Test
    void emptyConfigurationAllowsAnyOrigin() {
        assertEquals(List.of("*"), WebSocketConfig.originPatterns(""));
        assertEquals(List.of("*"), WebSocketConfig.originPatterns(null));
    }
}
