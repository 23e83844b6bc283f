package com.lab2fhir.domain;

import com.lab2fhir.service.StateTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.lab2fhir.domain.ReportStatus.*;

/**
 * Single source of truth for which report status changes are legal.
 * <p>
 * Lookups are pure. Persisting a new status is the caller's job and must only
 * happen after {@link #validateTransition(ReportStatus, ReportStatus)} returns.
 */
public final class ReportStateMachine {

    private static final Map<ReportStatus, Set<ReportStatus>> TRANSITIONS = new EnumMap<>(ReportStatus.class);

    static {
        TRANSITIONS.put(UPLOADED, EnumSet.of(PARSING, FAILED, DUPLICATE));
        TRANSITIONS.put(PARSING, EnumSet.of(REVIEW_PENDING, FAILED));
        TRANSITIONS.put(REVIEW_PENDING, EnumSet.of(EDITING, GENERATING_BUNDLE, FAILED));
        TRANSITIONS.put(EDITING, EnumSet.of(REVIEW_PENDING, GENERATING_BUNDLE, FAILED));
        TRANSITIONS.put(GENERATING_BUNDLE, EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(REGENERATING_BUNDLE, EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(REGENERATING_BUNDLE, EDITING));
        // retry re-entry points only
        TRANSITIONS.put(FAILED, EnumSet.of(PARSING, GENERATING_BUNDLE));
        TRANSITIONS.put(DUPLICATE, EnumSet.noneOf(ReportStatus.class));
    }

    private static final Set<ReportStatus> PROCESSING = EnumSet.of(PARSING, GENERATING_BUNDLE, REGENERATING_BUNDLE);
    private static final Set<ReportStatus> USER_ACTIONABLE = EnumSet.of(REVIEW_PENDING, EDITING, FAILED);

    private ReportStateMachine() {
    }

    public static boolean canTransition(ReportStatus from, ReportStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Throws a {@link StateTransitionException} naming both states when the move is not in the table.
     */
    public static void validateTransition(ReportStatus from, ReportStatus to) {
        if (!canTransition(from, to)) {
            throw new StateTransitionException(from, to);
        }
    }

    public static Set<ReportStatus> allowedTransitions(ReportStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public static boolean isTerminal(ReportStatus status) {
        return TRANSITIONS.get(status).isEmpty();
    }

    public static boolean isProcessing(ReportStatus status) {
        return PROCESSING.contains(status);
    }

    public static boolean isUserActionable(ReportStatus status) {
        return USER_ACTIONABLE.contains(status);
    }

    public static boolean isSuccess(ReportStatus status) {
        return status == COMPLETED;
    }

    public static boolean isError(ReportStatus status) {
        return status == FAILED;
    }
}
