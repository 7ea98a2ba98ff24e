package com.tidypipe.common;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tidypipe.backend.value.Table;

import static org.junit.jupiter.api.Assertions.*;

public class RunResultCodecTest {

    @Test
    public void testEncodeSuccess() {
        Table table = Table.builder(List.of("n", "label", "when", "gone"))
                .addRow(1, "one", Instant.parse("1984-01-01T00:00:00Z"), null)
                .addRow(2.5, "two", Instant.EPOCH, false)
                .build();
        RunResult result = RunResult.success(table, 1234);
        JsonObject json = JsonParser.parseString(
                new String(RunResultCodec.encode(result), StandardCharsets.UTF_8)).getAsJsonObject();

        assertEquals("", json.get("error").getAsString());
        assertTrue(json.get("errorKind").isJsonNull());
        assertEquals(1234, json.get("elapsedNanos").getAsLong());
        assertEquals(JsonParser.parseString("[\"n\",\"label\",\"when\",\"gone\"]"), json.get("columns"));

        JsonObject first = json.getAsJsonArray("table").get(0).getAsJsonObject();
        assertEquals("1", first.get("n").toString());
        assertEquals("1984-01-01T00:00:00Z", first.get("when").getAsString());
        assertTrue(first.get("gone").isJsonNull());
        JsonObject second = json.getAsJsonArray("table").get(1).getAsJsonObject();
        assertEquals(2.5, second.get("n").getAsDouble());
        assertFalse(second.get("gone").getAsBoolean());
    }

    @Test
    public void testEncodeFailure() {
        RunResult result = RunResult.failure(new PipelineException(ErrorKind.UNKNOWN_COLUMN, "Unknown column \"x\""), 5);
        JsonObject json = JsonParser.parseString(RunResultCodec.toJson(result)).getAsJsonObject();
        assertEquals("Unknown column \"x\"", json.get("error").getAsString());
        assertEquals("UNKNOWN_COLUMN", json.get("errorKind").getAsString());
        assertEquals(0, json.getAsJsonArray("table").size());
    }
}
