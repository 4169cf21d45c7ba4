package com.fvgscanner.report;

import com.fvgscanner.domain.model.ScanReport;

/**
 * Receives the report of every completed scan run. Sinks are called sequentially on
 * the orchestrator's thread; a failing sink is logged and does not affect the others.
 */
public interface SetupSink {

    void accept(ScanReport report);
}
