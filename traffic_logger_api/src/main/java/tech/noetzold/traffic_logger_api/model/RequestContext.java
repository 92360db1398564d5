package tech.noetzold.traffic_logger_api.model;

import lombok.Builder;
import lombok.Value;

/**
 * Who sent a request and from where. Built once when the request enters the
 * traffic filter and never shared with another request.
 */
@Value
@Builder
public class RequestContext {

    public static final String ANONYMOUS_USER = "*";

    String userName;
    String ip;
    String userAgent;
    String method;
    String path;
}
