package com.recaprio.projection.monitor;

import com.recaprio.projection.model.DriftRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingDriftReportSink implements DriftReportSink {

    private final MeterRegistry meterRegistry;

    @Override
    public void report(DriftRecord record) {
        log.warn("[MONITOR] Drift {} on key {}: expected={} actual={}{}",
                record.reason(), record.key(),
                record.expected() == null ? null : record.expected().values(),
                record.actual() == null ? null : record.actual().values(),
                record.detail() == null ? "" : " (" + record.detail() + ")");
        Counter.builder("projection.drift.detected")
                .tag("reason", record.reason().name())
                .register(meterRegistry)
                .increment();
    }
}
