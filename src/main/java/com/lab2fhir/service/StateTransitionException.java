package com.lab2fhir.service;

import com.lab2fhir.domain.ReportStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a caller asks for a status change the state machine does not allow.
 */
public class StateTransitionException extends PipelineException {

    private final ReportStatus from;
    private final ReportStatus to;

    public StateTransitionException(ReportStatus from, ReportStatus to) {
        super(ErrorCode.STATE_TRANSITION_ERROR,
                "Invalid state transition from " + wire(from) + " to " + wire(to),
                details(from, to));
        this.from = from;
        this.to = to;
    }

    public ReportStatus getFrom() {
        return from;
    }

    public ReportStatus getTo() {
        return to;
    }

    private static Map<String, Object> details(ReportStatus from, ReportStatus to) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from_status", wire(from));
        details.put("to_status", wire(to));
        return details;
    }

    private static String wire(ReportStatus status) {
        return status == null ? "null" : status.wireValue();
    }
}
