package com.hometwin.common.model.reading;

import com.hometwin.common.model.DeviceClassRule;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SensorReadingTest {

    private static final DeviceClassRule TEMPERATURE = DeviceClassRule.numeric("temperature", "dtmi:t;1");
    private static final DeviceClassRule MOTION = DeviceClassRule.onOff("motion", "dtmi:m;1");

    @Test
    void shouldParseNumericState() {
        SensorReading reading = SensorReading.from(TEMPERATURE, "21.5");

        assertThat(reading).isEqualTo(NumericReading.of(21.5));
        assertThat(reading.twinValue()).isEqualTo(21.5);
    }

    @Test
    void shouldAcceptSignedExponentAndPaddedNumbers() {
        assertThat(SensorReading.from(TEMPERATURE, "-3")).isEqualTo(NumericReading.of(-3.0));
        assertThat(SensorReading.from(TEMPERATURE, "1.2e3")).isEqualTo(NumericReading.of(1200.0));
        assertThat(SensorReading.from(TEMPERATURE, " 7 ")).isEqualTo(NumericReading.of(7.0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"unavailable", "unknown", "", "  ", "NaN", "Infinity", "21,5", "21.5f", "0x10", "1e400", "-1e400"})
    void shouldNotMapNonNumericState(String state) {
        SensorReading reading = SensorReading.from(TEMPERATURE, state);

        assertThat(reading).isInstanceOf(Unmapped.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"on", "ON", "On", "oN"})
    void shouldMapOnToTrueIgnoringCase(String state) {
        assertThat(SensorReading.from(MOTION, state)).isEqualTo(BooleanReading.of(true));
    }

    @ParameterizedTest
    @ValueSource(strings = {"off", "OFF", "unavailable", "1", "true", ""})
    void shouldMapAnythingElseToFalse(String state) {
        SensorReading reading = SensorReading.from(MOTION, state);

        assertThat(reading).isEqualTo(BooleanReading.of(false));
        assertThat(reading.twinValue()).isEqualTo(false);
    }

    @Test
    void unmappedShouldHaveNoTwinValue() {
        assertThatThrownBy(() -> Unmapped.because("state 'x' is not numeric").twinValue())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not numeric");
    }
}
