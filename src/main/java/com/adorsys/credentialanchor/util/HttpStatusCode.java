package com.adorsys.credentialanchor.util;

/**
 * HTTP status codes Horizon answers with.
 */
public enum HttpStatusCode {
    OK(200),
    SUCCESS_MAX(299),
    BAD_REQUEST(400),
    NOT_FOUND(404);

    private final int code;

    HttpStatusCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Checks if the HTTP status code indicates a successful response (2xx range).
     *
     * @param statusCode the HTTP status code to check
     * @return true if the status code is in the 200-299 range, false otherwise
     */
    public static boolean isSuccess(int statusCode) {
        return statusCode >= OK.getCode() && statusCode <= SUCCESS_MAX.getCode();
    }
}
