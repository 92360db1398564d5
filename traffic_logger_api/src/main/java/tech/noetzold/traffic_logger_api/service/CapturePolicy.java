package tech.noetzold.traffic_logger_api.service;

import tech.noetzold.traffic_logger_api.config.TrafficLoggingProperties;

/**
 * Decides whether a request or response body is small enough to be captured.
 * Content lengths follow the servlet convention: {@code -1} means not declared.
 * Both upper bounds are exclusive.
 */
public final class CapturePolicy {

    public static final long UNKNOWN_LENGTH = -1L;

    private final boolean requestCaptureEnabled;
    private final int requestMaxBytes;
    private final boolean responseCaptureEnabled;
    private final int responseMaxBytes;

    public CapturePolicy(boolean requestCaptureEnabled, int requestMaxBytes,
                         boolean responseCaptureEnabled, int responseMaxBytes) {
        this.requestCaptureEnabled = requestCaptureEnabled;
        this.requestMaxBytes = requestMaxBytes;
        this.responseCaptureEnabled = responseCaptureEnabled;
        this.responseMaxBytes = responseMaxBytes;
    }

    public static CapturePolicy from(TrafficLoggingProperties properties) {
        return new CapturePolicy(
                properties.getLogRequestBody(),
                properties.getLogRequestBodyMaxSize(),
                properties.getLogResponseBody(),
                properties.getLogResponseBodyMaxSize());
    }

    public boolean shouldCaptureRequest(long contentLength) {
        return requestCaptureEnabled && fits(contentLength, requestMaxBytes);
    }

    public boolean shouldCaptureResponse(long contentLength) {
        return responseCaptureEnabled && fits(contentLength, responseMaxBytes);
    }

    public boolean isRequestCaptureEnabled() {
        return requestCaptureEnabled;
    }

    public boolean isResponseCaptureEnabled() {
        return responseCaptureEnabled;
    }

    private static boolean fits(long contentLength, int maxBytes) {
        return contentLength != UNKNOWN_LENGTH && contentLength > 0 && contentLength < maxBytes;
    }
}
