package dev.maplecms.util;

import org.junit.jupiter.api.RepeatedTest;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {

    @RepeatedTest(5)
    void shouldDropSubMicrosecondDigits() {
        LocalDateTime now = Timestamps.now();

        assertThat(now.getNano() % 1_000).isZero();
        assertThat(now.truncatedTo(ChronoUnit.MICROS)).isEqualTo(now);
    }
}
