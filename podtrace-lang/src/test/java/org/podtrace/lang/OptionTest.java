package org.podtrace.lang;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OptionTest {

    @Test
    void option_isEmpty_forNull() {
        assertThat(Option.option(null).isEmpty()).isTrue();
        assertThat(Option.option("x").or("y")).isEqualTo("x");
    }

    @Test
    void map_toNull_becomesEmpty() {
        assertThat(Option.some("x").map(value -> null).isEmpty()).isTrue();
    }

    @Test
    void or_usesReplacement_onlyWhenEmpty() {
        assertThat(Option.<Integer>none().or(7)).isEqualTo(7);
        assertThat(Option.<Integer>none().or(() -> 8)).isEqualTo(8);
        assertThat(Option.some(1).filter(value -> value > 5).or(-1)).isEqualTo(-1);
    }

    @Test
    void toResult_failsWithGivenCause_whenEmpty() {
        Option.<String>none()
              .toResult(Causes.cause("absent"))
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> assertThat(cause.message()).isEqualTo("absent"));
        assertThat(Option.some("here").toResult(Causes.cause("absent")).unwrap()).isEqualTo("here");
    }
}
