package com.lab2fhir.service;

import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.repository.LabReportRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportTransitionServiceTest {

    private static final Instant NOW = Instant.parse("2024-02-01T12:00:00Z");

    @Mock
    private LabReportRepository reportRepository;

    private ReportTransitionService transitionService;
    private LabReport report;

    @BeforeEach
    void setUp() {
        transitionService = new ReportTransitionService(reportRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        report = LabReport.builder().id(UUID.randomUUID()).status(ReportStatus.UPLOADED).build();
    }

    @Test
    void writesConditionallyOnTheStatusThatWasRead() {
        LabReport reloaded = LabReport.builder().id(report.getId()).status(ReportStatus.PARSING).build();
        when(reportRepository.updateStatusIfMatches(report.getId(), ReportStatus.UPLOADED, ReportStatus.PARSING,
                null, null, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))).thenReturn(1);
        when(reportRepository.findById(report.getId())).thenReturn(Optional.of(reloaded));

        LabReport result = transitionService.transition(report, ReportStatus.PARSING);

        assertThat(result.getStatus()).isEqualTo(ReportStatus.PARSING);
    }

    @Test
    void storesErrorDetailsOnlyWhenFailing() {
        LabReport failed = LabReport.builder().id(report.getId()).status(ReportStatus.FAILED).build();
        when(reportRepository.updateStatusIfMatches(eq(report.getId()), eq(ReportStatus.UPLOADED),
                eq(ReportStatus.FAILED), eq("parsing_failed"), eq("no text"), any())).thenReturn(1);
        when(reportRepository.findById(report.getId())).thenReturn(Optional.of(failed));

        transitionService.transition(report, ReportStatus.FAILED, ErrorCode.PARSING_FAILED, "no text");

        verify(reportRepository).updateStatusIfMatches(eq(report.getId()), eq(ReportStatus.UPLOADED),
                eq(ReportStatus.FAILED), eq("parsing_failed"), eq("no text"), any());
    }

    @Test
    void illegalMoveNeverReachesTheDatabase() {
        assertThatThrownBy(() -> transitionService.transition(report, ReportStatus.COMPLETED))
                .isInstanceOf(StateTransitionException.class);
        verifyNoInteractions(reportRepository);
    }

    @Test
    void staleStatusIsAConflict() {
        when(reportRepository.updateStatusIfMatches(eq(report.getId()), eq(ReportStatus.UPLOADED),
                eq(ReportStatus.PARSING), isNull(), isNull(), any())).thenReturn(0);

        assertThatThrownBy(() -> transitionService.transition(report, ReportStatus.PARSING))
                .isInstanceOf(ConcurrentTransitionException.class)
                .extracting(e -> ((PipelineException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONFLICT);
        verify(reportRepository, never()).findById(any());
    }
}
