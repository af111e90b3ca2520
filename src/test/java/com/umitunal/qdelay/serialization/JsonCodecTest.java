package com.umitunal.qdelay.serialization;

import com.umitunal.qdelay.model.JobDescriptor;
import com.umitunal.qdelay.model.ScheduleDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    private final JsonCodec<JobDescriptor> jobCodec = new JsonCodec<>(JobDescriptor.class);
    private final JsonCodec<ScheduleDefinition> scheduleCodec = new JsonCodec<>(ScheduleDefinition.class);

    @Test
    @DisplayName("Should write job properties in sorted order")
    void testJobEncodingLayout() {
        // Given
        JobDescriptor job = JobDescriptor.of("Send", "mail", "x");

        // When
        String json = new String(jobCodec.encode(job), UTF_8);

        // Then
        assertThat(json).isEqualTo("{\"args\":[\"x\"],\"class\":\"Send\",\"queue\":\"mail\"}");
    }

    @Test
    @DisplayName("Should decode what it encodes")
    void testJobDecode() {
        // Given
        JobDescriptor job = JobDescriptor.of("Resize", "media", "cat.png", 640, true);

        // When
        JobDescriptor decoded = jobCodec.decode(jobCodec.encode(job));

        // Then
        assertThat(decoded).isEqualTo(job);
        assertThat(decoded.getArgs()).containsExactly("cat.png", 640, true);
    }

    @Test
    @DisplayName("Should encode maps identically regardless of insertion order")
    void testCanonicalMapOrder() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("zeta", 1);
        first.put("alpha", List.of("a", "b"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("alpha", List.of("a", "b"));
        second.put("zeta", 1);

        // When
        byte[] a = jobCodec.encode(JobDescriptor.of("Report", "default", first));
        byte[] b = jobCodec.encode(JobDescriptor.of("Report", "default", second));

        // Then
        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("Should leave unset schedule fields out of the encoding")
    void testScheduleEncodingOmitsNulls() {
        // Given
        ScheduleDefinition definition = ScheduleDefinition.builder().every("1m").build();

        // When
        String json = new String(scheduleCodec.encode(definition), UTF_8);

        // Then
        assertThat(json).isEqualTo("{\"every\":\"1m\"}");
    }

    @Test
    @DisplayName("Should convert loosely typed schedule configuration")
    void testConvertRawSchedule() {
        // Given
        Map<String, Object> raw = Map.of(
                "cron", "0 * * * *",
                "class", "ClearCache",
                "args", "all",
                "rails_envs", "production, staging",
                "description", "Hourly flush",
                "custom_job_class", "Ignored");

        // When
        ScheduleDefinition definition = scheduleCodec.convert(raw);

        // Then
        assertThat(definition.getClassName()).isEqualTo("ClearCache");
        assertThat(definition.getCron()).isEqualTo("0 * * * *");
        assertThat(definition.getArgs()).isEqualTo("all");
        assertThat(definition.getEnvs()).containsExactly("production", "staging");
        assertThat(definition.getDescription()).isEqualTo("Hourly flush");
    }

    @Test
    @DisplayName("Should wrap malformed input in a runtime exception")
    void testDecodeFailure() {
        assertThatThrownBy(() -> jobCodec.decode("not json".getBytes(UTF_8)))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("JobDescriptor");
    }
}
