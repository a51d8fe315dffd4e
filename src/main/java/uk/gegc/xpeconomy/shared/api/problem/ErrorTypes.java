package uk.gegc.xpeconomy.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 problem type URIs returned by the XP API.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://xp.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Ledger Errors ====================
    public static final URI INSUFFICIENT_XP = URI.create(BASE_URL + "/insufficient-xp");
    public static final URI IDEMPOTENCY_CONFLICT = URI.create(BASE_URL + "/idempotency-conflict");
    public static final URI TRANSIENT_CONFLICT = URI.create(BASE_URL + "/transient-conflict");
    public static final URI SPENDING_FROZEN = URI.create(BASE_URL + "/spending-frozen");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");
    public static final URI DUPLICATE_ACCOUNT = URI.create(BASE_URL + "/duplicate-account");

    // ==================== Store & Social Errors ====================
    public static final URI FEATURE_ALREADY_OWNED = URI.create(BASE_URL + "/feature-already-owned");
    public static final URI COMMENT_NOT_UNLOCKED = URI.create(BASE_URL + "/comment-not-unlocked");
    public static final URI DUPLICATE_INTERACTION = URI.create(BASE_URL + "/duplicate-interaction");

    // ==================== Quiz Errors ====================
    public static final URI GRADING_TIMEOUT = URI.create(BASE_URL + "/grading-timeout");
    public static final URI GRADING_FAILED = URI.create(BASE_URL + "/grading-failed");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
