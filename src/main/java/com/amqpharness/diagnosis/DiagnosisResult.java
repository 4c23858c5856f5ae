package com.amqpharness.diagnosis;

/**
 * Classified outcome of one connection attempt.
 */
public final class DiagnosisResult {

    public enum Outcome {
        OK,
        BAD_CREDENTIALS,
        BAD_VIRTUAL_HOST,
        UNKNOWN
    }

    private static final DiagnosisResult OK = new DiagnosisResult(Outcome.OK, null);
    private static final DiagnosisResult NOT_DIAGNOSED = new DiagnosisResult(Outcome.UNKNOWN, null);

    private final Outcome outcome;
    private final Throwable cause;

    private DiagnosisResult(Outcome outcome, Throwable cause) {
        this.outcome = outcome;
        this.cause = cause;
    }

    public static DiagnosisResult ok() {
        return OK;
    }

    public static DiagnosisResult badCredentials(Throwable cause) {
        return new DiagnosisResult(Outcome.BAD_CREDENTIALS, cause);
    }

    public static DiagnosisResult badVirtualHost(Throwable cause) {
        return new DiagnosisResult(Outcome.BAD_VIRTUAL_HOST, cause);
    }

    public static DiagnosisResult unknown(Throwable cause) {
        return new DiagnosisResult(Outcome.UNKNOWN, cause);
    }

    /**
     * Result for a transport the heuristics do not apply to; no attempt was made.
     */
    public static DiagnosisResult notDiagnosed() {
        return NOT_DIAGNOSED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Throwable getCause() {
        return cause;
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    @Override
    public String toString() {
        return cause == null
            ? String.format("DiagnosisResult{%s}", outcome)
            : String.format("DiagnosisResult{%s, cause=%s}", outcome, cause);
    }
}
