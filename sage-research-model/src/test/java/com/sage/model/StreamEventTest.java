package com.sage.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StreamEventTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void serializesOnlyFieldsRelevantToType() throws Exception {
        assertEquals("{\"type\":\"token\",\"token\":\"Hi\"}", MAPPER.writeValueAsString(StreamEvent.token("Hi")));
        assertEquals("{\"type\":\"done\"}", MAPPER.writeValueAsString(StreamEvent.done()));
        assertEquals("{\"type\":\"model_info\",\"model\":\"llama3.2\"}", MAPPER.writeValueAsString(StreamEvent.modelInfo("llama3.2")));
    }

    @Test
    void parsesErrorEvent() throws Exception {
        StreamEvent event = MAPPER.readValue("{\"type\":\"error\",\"error\":\"boom\"}", StreamEvent.class);
        assertEquals(StreamEvent.Type.ERROR, event.getType());
        assertEquals("boom", event.getError());
    }
}
