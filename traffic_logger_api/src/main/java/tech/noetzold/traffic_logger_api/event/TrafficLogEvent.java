package tech.noetzold.traffic_logger_api.event;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class TrafficLogEvent {

    public static final String REQUEST_METHOD = "RequestMethod";
    public static final String REQUEST_PATH = "RequestPath";
    public static final String REQUEST_HEADERS = "RequestHeaders";
    public static final String REQUEST_BODY = "RequestBody";
    public static final String RESPONSE_BODY = "ResponseBody";
    public static final String STATUS_CODE = "StatusCode";
    public static final String ERROR = "Error";

    public static final String USER_NAME = "UserName";
    public static final String IP = "IP";
    public static final String USER_AGENT = "UserAgent";

    TrafficTemplate template;

    @Singular
    Map<String, Object> fields;

    // caller identity fields merged from the request context
    @Singular("contextField")
    Map<String, String> context;

    long timestamp;
}
