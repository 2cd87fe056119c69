package com.phillippitts.reqlog.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void convertsNanosToFractionalMicros() {
        assertThat(TimeUtils.nanosToMicros(1_500)).isEqualTo(1.5, within(1e-9));
        assertThat(TimeUtils.nanosToMicros(0)).isZero();
    }
}
