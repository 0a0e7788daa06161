package org.javai.storage.error;

/**
 * One entry of the {@code errors} list in a service error response.
 *
 * @param reason Short machine-readable code, e.g. {@code "rateLimitExceeded"}; never null
 * @param message Human-readable description (may be null)
 * @param domain The error domain, e.g. {@code "global"} (may be null)
 * @param location The request part the error refers to (may be null)
 * @param locationType How {@code location} should be read, e.g. {@code "header"} (may be null)
 */
public record ErrorDetail(
        String reason,
        String message,
        String domain,
        String location,
        String locationType
) {

    public ErrorDetail {
        reason = reason == null ? "" : reason;
    }

    public static ErrorDetail of(String reason) {
        return new ErrorDetail(reason, null, null, null, null);
    }

    public static ErrorDetail of(String reason, String message) {
        return new ErrorDetail(reason, message, null, null, null);
    }
}
