package io.sylabs.scs.keyclient.internal;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void omitsNullFieldsWhenWriting() throws Exception {
        assertEquals("{\"fingerprint\":\"AA\"}", Json.mapper().writeValueAsString(new KeyRef("AA", null)));
    }

    @Test
    void writesMapsAsObjects() throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("keyText", "armored");

        assertEquals("{\"keyText\":\"armored\"}", Json.mapper().writeValueAsString(body));
    }

    record KeyRef(String fingerprint, String comment) {
    }
}
