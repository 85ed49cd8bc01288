package org.podtrace.series;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {

    @Test
    void parse_readsExporterFormatAsUtc() {
        assertThat(Timestamps.parse("2026-01-20 14:23:05").or(Instant.EPOCH))
            .isEqualTo(Instant.parse("2026-01-20T14:23:05Z"));
        assertThat(Timestamps.parse("2026-01-20 14:23:05.250").or(Instant.EPOCH))
            .isEqualTo(Instant.parse("2026-01-20T14:23:05.250Z"));
    }

    @Test
    void parse_readsIsoWithOffset() {
        assertThat(Timestamps.parse("2026-01-20T15:23:05+01:00").or(Instant.EPOCH))
            .isEqualTo(Instant.parse("2026-01-20T14:23:05Z"));
        assertThat(Timestamps.parse("2026-01-20T14:23:05Z").or(Instant.EPOCH))
            .isEqualTo(Instant.parse("2026-01-20T14:23:05Z"));
    }

    @Test
    void parse_readsEpochSeconds() {
        assertThat(Timestamps.parse("1768919000").or(Instant.EPOCH)).isEqualTo(Instant.ofEpochSecond(1768919000L));
        assertThat(Timestamps.parse("1768919000.5").or(Instant.EPOCH))
            .isEqualTo(Instant.ofEpochSecond(1768919000L, 500_000_000L));
    }

    @Test
    void parse_isEmpty_forEpochSecondsOutsideInstantRange() {
        assertThat(Timestamps.parse("100000000000000000").isEmpty()).isTrue();
        assertThat(Timestamps.parse("-100000000000000000").isEmpty()).isTrue();
        assertThat(Timestamps.parse("18446744073709551617").isEmpty()).isTrue();
    }

    @Test
    void parse_isEmpty_forGarbage() {
        assertThat(Timestamps.parse("yesterday").isEmpty()).isTrue();
        assertThat(Timestamps.parse("").isEmpty()).isTrue();
        assertThat(Timestamps.parse("2026-13-45 10:00:00").isEmpty()).isTrue();
    }
}
