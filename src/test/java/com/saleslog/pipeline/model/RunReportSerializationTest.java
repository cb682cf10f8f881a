package com.saleslog.pipeline.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saleslog.pipeline.factory.JsonFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunReportSerializationTest {

    private final ObjectMapper objectMapper = new JsonFactory().reportObjectMapper();

    @Test
    @DisplayName("RunReport serializes with snake_case names and ISO-8601 instants")
    void runReportSerializeDeserialize() throws Exception {
        BucketId failed = new BucketId("2024112315");
        RunReport report = RunReport.from(
                Instant.parse("2024-11-23T16:00:00Z"),
                Instant.parse("2024-11-23T16:00:05Z"),
                List.of(
                        new BucketResult("2024112314", BucketOutcome.WRITTEN, 1L, 0, List.of(), "output/2024112314.txt", null),
                        BucketResult.failed(failed, "Cannot write summary for bucket 2024112315: disk full")));

        String json = objectMapper.writeValueAsString(report);
        assertThat(json).contains("\"started_at\" : \"2024-11-23T16:00:00Z\"");
        assertThat(json).contains("\"buckets_written\" : 1");
        assertThat(json).contains("\"buckets_failed\" : 1");
        assertThat(json).contains("\"parse_errors\" : 1");
        assertThat(json).contains("\"bucket_id\" : \"2024112315\"");
        assertThat(json).contains("disk full");

        RunReport restored = objectMapper.readValue(json, RunReport.class);
        assertThat(restored).isEqualTo(report);
    }
}
