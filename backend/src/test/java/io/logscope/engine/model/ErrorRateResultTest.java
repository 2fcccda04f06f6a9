package io.logscope.engine.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ErrorRateResultTest {

    @Test
    void rateCountsErrorsAndFatalsButNotWarnings() {
        // 2 info, 1 warning, 1 error, 1 fatal
        ErrorRateResult result = ErrorRateResult.of(5, 1, 1, 1);

        assertThat(result.rate()).isCloseTo(0.4, within(1e-9));
        assertThat(result.warnings()).isEqualTo(1);
    }

    @Test
    void emptyWindowHasZeroRate() {
        assertThat(ErrorRateResult.of(0, 0, 0, 0).rate()).isZero();
    }
}
