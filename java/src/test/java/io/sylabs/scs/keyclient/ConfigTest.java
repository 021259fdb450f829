package io.sylabs.scs.keyclient;

import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void defaultsLeaveEveryFieldUnset() {
        Config config = Config.defaults();

        assertEquals(Optional.empty(), config.getBaseUrl());
        assertEquals(Optional.empty(), config.getAuthToken());
        assertEquals(Optional.empty(), config.getUserAgent());
        assertEquals(Optional.empty(), config.getHttpClient());
    }

    @Test
    void treatsEmptyStringsAsUnset() {
        Config config = Config.builder()
            .baseUrl("")
            .authToken("")
            .userAgent("")
            .build();

        assertTrue(config.getBaseUrl().isEmpty());
        assertTrue(config.getAuthToken().isEmpty());
        assertTrue(config.getUserAgent().isEmpty());
    }

    @Test
    void toBuilderCopiesEveryField() {
        HttpClient httpClient = HttpClient.newHttpClient();
        Config original = Config.builder()
            .baseUrl("hkps://keys.example.org")
            .authToken("abc123")
            .userAgent("myagent/1.0")
            .httpClient(httpClient)
            .build();

        Config copy = original.toBuilder().userAgent("other/2.0").build();

        assertEquals(Optional.of("hkps://keys.example.org"), copy.getBaseUrl());
        assertEquals(Optional.of("abc123"), copy.getAuthToken());
        assertEquals(Optional.of("other/2.0"), copy.getUserAgent());
        assertSame(httpClient, copy.getHttpClient().orElseThrow());
        assertEquals(Optional.of("myagent/1.0"), original.getUserAgent());
    }
}
