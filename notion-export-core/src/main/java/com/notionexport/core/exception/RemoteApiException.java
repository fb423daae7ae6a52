package com.notionexport.core.exception;

import java.util.Set;

/**
 * Failure reported by the remote content API, or by the transport underneath it.
 *
 * <p>Classification is driven by the HTTP status:
 * <ul>
 *   <li>400, 403, 404 are permanent and never retried</li>
 *   <li>429, 500, 502, 503, 504 and status-less failures (I/O errors) are transient</li>
 *   <li>any other status is neither: it propagates without retry</li>
 * </ul>
 */
public class RemoteApiException extends ExportException {

    private static final Set<Integer> PERMANENT_STATUSES = Set.of(400, 403, 404);
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final Set<Integer> INACCESSIBLE_STATUSES = Set.of(403, 404);

    private final Integer status;
    private final String code;

    public RemoteApiException(Integer status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
        this.code = null;
    }

    /**
     * Returns the HTTP status, or {@code null} when the call failed before a response arrived.
     *
     * @return status code or null
     */
    public Integer getStatus() {
        return status;
    }

    /**
     * Returns the API error code (e.g. {@code object_not_found}), if the response carried one.
     *
     * @return error code or null
     */
    public String getCode() {
        return code;
    }

    public boolean isPermanent() {
        return status != null && PERMANENT_STATUSES.contains(status);
    }

    public boolean isTransient() {
        return status == null || TRANSIENT_STATUSES.contains(status);
    }

    /**
     * Forbidden or not found: the integration cannot see this object.
     *
     * @return true for 403 and 404
     */
    public boolean isInaccessible() {
        return status != null && INACCESSIBLE_STATUSES.contains(status);
    }

    @Override
    public String toString() {
        return "RemoteApiException{status=" + status + ", code=" + code + ", message=" + getMessage() + "}";
    }
}
