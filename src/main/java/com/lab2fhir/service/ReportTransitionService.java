package com.lab2fhir.service;

import com.lab2fhir.domain.ReportStateMachine;
import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.repository.LabReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * The only writer of {@link LabReport#getStatus()}.
 * <p>
 * Every write is checked against {@link ReportStateMachine} and then applied with a conditional
 * update on the status the caller read, so a concurrent writer in another process turns into a
 * {@link ConcurrentTransitionException} instead of a lost update.
 */
@Service
public class ReportTransitionService {

    private static final Logger logger = LoggerFactory.getLogger(ReportTransitionService.class);

    private final LabReportRepository reportRepository;
    private final Clock clock;

    public ReportTransitionService(LabReportRepository reportRepository, Clock clock) {
        this.reportRepository = reportRepository;
        this.clock = clock;
    }

    @Transactional
    public LabReport transition(LabReport report, ReportStatus target) {
        return transition(report, target, null, null);
    }

    /**
     * Moves the report to {@code target}. Error details are stored only for {@code failed};
     * any other target clears them.
     *
     * @return the report as re-read after the write
     */
    @Transactional
    public LabReport transition(LabReport report, ReportStatus target, ErrorCode errorCode, String errorMessage) {
        ReportStatus current = report.getStatus();
        ReportStateMachine.validateTransition(current, target);

        boolean failing = target == ReportStatus.FAILED;
        int updated = reportRepository.updateStatusIfMatches(
                report.getId(),
                current,
                target,
                failing && errorCode != null ? errorCode.code() : null,
                failing ? errorMessage : null,
                OffsetDateTime.now(clock));
        if (updated == 0) {
            logger.warn("Report {} changed concurrently; expected status {} before moving to {}",
                    report.getId(), current.wireValue(), target.wireValue());
            throw new ConcurrentTransitionException(report.getId(), current, target);
        }
        logger.info("Report {} transitioned {} -> {}", report.getId(), current.wireValue(), target.wireValue());
        return reportRepository.findById(report.getId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.REPORT_NOT_FOUND, "Report", report.getId()));
    }
}
