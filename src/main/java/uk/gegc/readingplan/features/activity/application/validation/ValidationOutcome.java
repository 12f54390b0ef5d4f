package uk.gegc.readingplan.features.activity.application.validation;

/**
 * Result of checking one activity response. Invalid outcomes carry a reason for the client.
 */
public record ValidationOutcome(boolean valid, String reason) {

    private static final ValidationOutcome VALID = new ValidationOutcome(true, null);

    public static ValidationOutcome ok() {
        return VALID;
    }

    public static ValidationOutcome invalid(String reason) {
        return new ValidationOutcome(false, reason);
    }
}
