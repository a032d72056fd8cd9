package com.ryuqq.poolguard.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TaskResourceMeter 유닛 테스트.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
class TaskResourceMeterTest {

    @Test
    void 측정값은_음수가_아님() {
        // given
        TaskResourceMeter meter = new TaskResourceMeter();
        TaskResourceMeter.Sample sample = meter.begin();
        StringBuilder work = new StringBuilder();
        for (int i = 0; i < 10_000; i++) {
            work.append(i);
        }

        // when
        TaskResourceMeter.Usage usage = meter.since(sample);

        // then
        assertThat(work.length()).isPositive();
        assertThat(usage.cpuMillis()).isGreaterThanOrEqualTo(0);
        assertThat(usage.allocatedBytes()).isGreaterThanOrEqualTo(0);
        if (meter.isAllocationSupported()) {
            assertThat(usage.allocatedBytes()).isPositive();
        }
    }
}
