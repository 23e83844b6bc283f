package com.lab2fhir.service;

import com.lab2fhir.model.BundleArtifact;
import com.lab2fhir.model.EditHistoryEntry;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.repository.BundleArtifactRepository;
import com.lab2fhir.repository.LabReportRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read side of the pipeline: reports, versions, edit history, artifacts and source documents.
 */
@Service
public class ReportQueryService {

    private final LabReportRepository reportRepository;
    private final BundleArtifactRepository artifactRepository;
    private final VersionLedgerService ledger;
    private final SourceDocumentStore documentStore;

    public ReportQueryService(LabReportRepository reportRepository,
                              BundleArtifactRepository artifactRepository,
                              VersionLedgerService ledger,
                              SourceDocumentStore documentStore) {
        this.reportRepository = reportRepository;
        this.artifactRepository = artifactRepository;
        this.ledger = ledger;
        this.documentStore = documentStore;
    }

    @Transactional(readOnly = true)
    public LabReport getReport(UUID reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.REPORT_NOT_FOUND, "Report", reportId));
    }

    @Transactional(readOnly = true)
    public List<LabReport> listReports(UUID patientId) {
        if (patientId == null) {
            return reportRepository.findAllByOrderByCreatedAtDesc();
        }
        return reportRepository.findAllByPatientIdOrderByCreatedAtDesc(patientId);
    }

    @Transactional(readOnly = true)
    public StructuredVersion latestValidVersion(UUID reportId) {
        getReport(reportId);
        return ledger.latestValid(reportId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PARSED_DATA_NOT_FOUND,
                        "Valid structured version", reportId));
    }

    @Transactional(readOnly = true)
    public List<StructuredVersion> listVersions(UUID reportId) {
        getReport(reportId);
        return ledger.listVersions(reportId);
    }

    @Transactional(readOnly = true)
    public List<EditHistoryEntry> listEdits(UUID reportId, int versionNumber) {
        getReport(reportId);
        return ledger.listEdits(reportId, versionNumber);
    }

    @Transactional(readOnly = true)
    public BundleArtifact latestArtifact(UUID reportId) {
        getReport(reportId);
        return artifactRepository.findFirstByReportIdOrderByArtifactNumberDesc(reportId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.BUNDLE_NOT_FOUND, "Bundle", reportId));
    }

    @Transactional(readOnly = true)
    public List<BundleArtifact> listArtifacts(UUID reportId) {
        getReport(reportId);
        return artifactRepository.findAllByReportIdOrderByArtifactNumberDesc(reportId);
    }

    /**
     * Raw bytes of the uploaded document. Duplicates share the canonical report's stored object.
     */
    public byte[] loadDocument(LabReport report) {
        if (report.getStorageUri() == null) {
            throw new NotFoundException(ErrorCode.NOT_FOUND, "Document", report.getId());
        }
        return documentStore.load(report.getStorageUri());
    }
}
