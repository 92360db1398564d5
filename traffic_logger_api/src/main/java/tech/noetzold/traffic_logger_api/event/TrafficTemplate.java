package tech.noetzold.traffic_logger_api.event;

public enum TrafficTemplate {

    REQUEST_CAPTURED("HTTP Request: {RequestMethod} {RequestPath}"),
    REQUEST_SKIPPED("HTTP Request: {RequestMethod} {RequestPath} (Body Skipped)"),
    RESPONSE_CAPTURED("HTTP Response: {RequestMethod} {RequestPath} {StatusCode}"),
    RESPONSE_SKIPPED("HTTP Response: {RequestMethod} {RequestPath} {StatusCode} (Body Skipped)");

    private final String messageTemplate;

    TrafficTemplate(String messageTemplate) {
        this.messageTemplate = messageTemplate;
    }

    public String getMessageTemplate() {
        return messageTemplate;
    }

    public boolean isRequestPhase() {
        return this == REQUEST_CAPTURED || this == REQUEST_SKIPPED;
    }

    public boolean isCaptured() {
        return this == REQUEST_CAPTURED || this == RESPONSE_CAPTURED;
    }
}
