package com.recaprio.projection.monitor;

import com.recaprio.projection.model.DriftRecord;

/**
 * Receives newly detected drift.
 */
public interface DriftReportSink {

    void report(DriftRecord record);
}
