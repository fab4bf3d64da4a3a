package com.scrapehub.jobs.util;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronExpressionsTest {

    @Test
    void fiveFieldExpressionGetsSecondsField() {
        assertThat(CronExpressions.toSpringPattern("*/5 * * * *")).isEqualTo("0 */5 * * * *");
        assertThat(CronExpressions.toSpringPattern("  0   9 * * MON-FRI ")).isEqualTo("0 0 9 * * MON-FRI");
    }

    @Test
    void sixFieldExpressionAndMacrosPassThrough() {
        assertThat(CronExpressions.toSpringPattern("30 */5 * * * *")).isEqualTo("30 */5 * * * *");
        assertThat(CronExpressions.toSpringPattern("@Hourly")).isEqualTo("@hourly");
    }

    @Test
    void nextFiringIsEvaluatedInJobZone() {
        ZoneId zone = ZoneId.of("America/New_York");
        CronExpression cron = CronExpressions.parse("0 9 * * *");

        ZonedDateTime next = cron.next(ZonedDateTime.of(2026, 3, 2, 8, 59, 30, 0, zone));

        assertThat(next).isEqualTo(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, zone));
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThat(CronExpressions.isValid("garbage")).isFalse();
        assertThat(CronExpressions.isValid("61 * * * *")).isFalse();
        assertThat(CronExpressions.isValid("* * * *")).isFalse();
        assertThat(CronExpressions.isValid("@fortnightly")).isFalse();
        assertThat(CronExpressions.isValid(null)).isFalse();
        assertThatThrownBy(() -> CronExpressions.toSpringPattern("  "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
