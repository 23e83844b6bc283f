package com.lab2fhir.service;

import com.lab2fhir.domain.ReportStatus;

import java.util.Map;
import java.util.UUID;

/**
 * The stored status changed between read and conditional write.
 */
public class ConcurrentTransitionException extends PipelineException {

    public ConcurrentTransitionException(UUID reportId, ReportStatus expected, ReportStatus target) {
        super(ErrorCode.CONFLICT,
                "Report " + reportId + " is no longer in status " + expected.wireValue(),
                Map.of("report_id", reportId.toString(),
                        "expected_status", expected.wireValue(),
                        "to_status", target.wireValue()));
    }
}
