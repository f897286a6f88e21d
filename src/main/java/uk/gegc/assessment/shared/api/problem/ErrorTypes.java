package uk.gegc.assessment.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://assessments.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI UNSUPPORTED_QUESTION_TYPE = URI.create(BASE_URL + "/unsupported-question-type");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Attempt Errors ====================
    public static final URI INVALID_ATTEMPT_STATE = URI.create(BASE_URL + "/invalid-attempt-state");
    public static final URI ATTEMPT_ALREADY_SUBMITTED = URI.create(BASE_URL + "/attempt-already-submitted");
    public static final URI ATTEMPT_CANNOT_START = URI.create(BASE_URL + "/attempt-cannot-start");
    public static final URI TIME_EXPIRED = URI.create(BASE_URL + "/time-expired");

    // ==================== Grading Errors ====================
    public static final URI GRADING_NOT_ALLOWED = URI.create(BASE_URL + "/grading-not-allowed");

    // ==================== State Errors ====================
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
