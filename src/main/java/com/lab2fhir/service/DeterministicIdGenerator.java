package com.lab2fhir.service;

import com.google.common.base.Joiner;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives resource identifiers purely from semantic content.
 * <p>
 * Components are canonicalized, joined with {@code |}, hashed with SHA-256 and the first
 * {@value #ID_HASH_LENGTH} hex characters are appended to a type prefix. Callers normalize
 * analyte names and units before passing them in.
 */
@Component
public class DeterministicIdGenerator {

    static final int ID_HASH_LENGTH = 16;
    private static final String SEPARATOR = "|";
    private static final String NULL_COMPONENT = "null";
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ContentHashingService hashingService;

    public DeterministicIdGenerator(ContentHashingService hashingService) {
        this.hashingService = hashingService;
    }

    public String deterministicId(String prefix, Object... components) {
        List<String> parts = new ArrayList<>(components.length);
        for (Object component : components) {
            parts.add(canonicalize(component));
        }
        String digest = hashingService.hash(Joiner.on(SEPARATOR).join(parts));
        return prefix + "-" + digest.substring(0, ID_HASH_LENGTH);
    }

    public String patientId(String externalSubjectId) {
        return deterministicId("pat", externalSubjectId);
    }

    public String documentReferenceId(String contentHash) {
        return deterministicId("doc", contentHash);
    }

    public String observationId(String subjectId, OffsetDateTime collected, String normalizedAnalyte,
                                Object value, String normalizedUnit) {
        return deterministicId("obs", subjectId, collected, normalizedAnalyte, value, normalizedUnit);
    }

    public String diagnosticReportId(String subjectId, OffsetDateTime reportDate, String contentHash) {
        String hashPrefix = contentHash == null ? null : contentHash.substring(0, Math.min(ID_HASH_LENGTH, contentHash.length()));
        return deterministicId("diag", subjectId, reportDate, hashPrefix);
    }

    /**
     * Fixed text form of one identifier component.
     */
    public static String canonicalize(Object component) {
        if (component == null) {
            return NULL_COMPONENT;
        }
        if (component instanceof OffsetDateTime) {
            return formatUtc(((OffsetDateTime) component).withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (component instanceof ZonedDateTime) {
            return formatUtc(((ZonedDateTime) component).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (component instanceof Instant) {
            return formatUtc(((Instant) component).atOffset(ZoneOffset.UTC));
        }
        if (component instanceof Integer || component instanceof Long
                || component instanceof Short || component instanceof BigInteger) {
            return component.toString();
        }
        if (component instanceof Double || component instanceof Float) {
            double value = ((Number) component).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Non-finite numeric component: " + value);
            }
            return decimal(BigDecimal.valueOf(value));
        }
        if (component instanceof BigDecimal) {
            return decimal((BigDecimal) component);
        }
        return component.toString();
    }

    // Fractional numbers always keep at least one decimal place, so 95.0 stays "95.0".
    private static String decimal(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 1) {
            stripped = stripped.setScale(1);
        }
        return stripped.toPlainString();
    }

    private static String formatUtc(OffsetDateTime utc) {
        StringBuilder text = new StringBuilder(SECONDS.format(utc));
        int micros = utc.getNano() / 1000;
        if (micros != 0) {
            text.append('.').append(String.format(Locale.ROOT, "%06d", micros));
        }
        return text.append("+00:00").toString();
    }
}
