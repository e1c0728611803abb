package com.jmulocity.common.status;

/**
 * Status codes for client-side operations. Each code names the layer an error came from, so a
 * caller can tell a misused encoder directive apart from a dropped connection or a rejected
 * request without inspecting messages.
 */
public enum StatusCode {
    OK,         // Operation succeeded
    CLIENT,     // The caller passed an unusable argument (bad page reference, page size, ...)
    SCHEMA,     // Encoder directive misuse or a value that is not a structured record
    TRANSPORT,  // The network exchange could not complete
    DECODE,     // The response body could not be parsed into the expected shape
    REMOTE;     // The platform answered with a non-success status

    /**
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }

    /**
     * Returns whether an HTTP status code counts as success for the platform's REST API.
     *
     * @param httpStatusCode the HTTP status code to check
     * @return true for any 2xx code
     */
    public static boolean isHttpSuccess(int httpStatusCode) {
        return httpStatusCode >= 200 && httpStatusCode < 300;
    }
}
