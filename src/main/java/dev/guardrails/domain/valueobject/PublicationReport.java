package dev.guardrails.domain.valueobject;

/**
 * What one publication pass achieved. Failed sub-steps are logged where they happen;
 * this only carries the tallies.
 */
public record PublicationReport(boolean summaryPosted, int annotationsAttempted,
                                int annotationsPosted, boolean statusSet) {

    public int annotationsFailed() {
        return annotationsAttempted - annotationsPosted;
    }

    public boolean isComplete() {
        return summaryPosted && statusSet && annotationsFailed() == 0;
    }
}
