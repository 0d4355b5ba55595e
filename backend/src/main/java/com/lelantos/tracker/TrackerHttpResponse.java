package com.lelantos.tracker;

/**
 * Status and raw body of one upstream answer. Body is empty, never null.
 */
public record TrackerHttpResponse(int status, String body) {

    public boolean isThrottled() {
        return status == 429;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
