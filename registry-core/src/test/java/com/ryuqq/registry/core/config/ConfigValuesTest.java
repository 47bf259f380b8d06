package com.ryuqq.registry.core.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValuesTest {

    @Test
    void 값이_없거나_공백이면_기본값() {
        Map<String, String> env = Map.of("BLANK", "  ");

        assertThat(ConfigValues.intValue(env, "MISSING", 7)).isEqualTo(7);
        assertThat(ConfigValues.longValue(env, "BLANK", 9L)).isEqualTo(9L);
        assertThat(ConfigValues.doubleValue(null, "ANY", 50.0)).isEqualTo(50.0);
    }

    @Test
    void 앞뒤_공백을_제거하고_파싱한다() {
        Map<String, String> env = Map.of(
            "SIZE", " 25 ",
            "DELAY_MS", "120000",
            "PERCENT", "37.5"
        );

        assertThat(ConfigValues.intValue(env, "SIZE", 0)).isEqualTo(25);
        assertThat(ConfigValues.longValue(env, "DELAY_MS", 0L)).isEqualTo(120_000L);
        assertThat(ConfigValues.doubleValue(env, "PERCENT", 0.0)).isEqualTo(37.5);
    }

    @Test
    void 잘못된_값은_키_이름을_포함한_예외() {
        Map<String, String> env = Map.of("BATCH_SIZE", "ten", "CB_PERCENT", "half");

        assertThatThrownBy(() -> ConfigValues.intValue(env, "BATCH_SIZE", 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("BATCH_SIZE must be an integer (current: ten)")
            .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> ConfigValues.longValue(env, "BATCH_SIZE", 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("BATCH_SIZE");
        assertThatThrownBy(() -> ConfigValues.doubleValue(env, "CB_PERCENT", 1.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("CB_PERCENT must be a number (current: half)");
    }
}
