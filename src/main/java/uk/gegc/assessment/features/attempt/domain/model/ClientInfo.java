package uk.gegc.assessment.features.attempt.domain.model;

/**
 * Request metadata recorded when an attempt starts.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    public static final ClientInfo UNKNOWN = new ClientInfo(null, null);
}
