package tech.noetzold.traffic_logger_api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.noetzold.traffic_logger_api.config.TrafficLoggingProperties;
import tech.noetzold.traffic_logger_api.event.TrafficLogEvent;
import tech.noetzold.traffic_logger_api.model.RequestContext;

import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class CallerContextEnricher {

    private final boolean trustForwardedHeaders;

    public CallerContextEnricher(TrafficLoggingProperties properties) {
        this.trustForwardedHeaders = properties.isTrustForwardedHeaders();
    }

    public RequestContext resolve(HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return RequestContext.builder()
                .userName(resolveUserName(request))
                .ip(resolveClientIp(request))
                .userAgent(userAgent != null ? userAgent : "")
                .method(request.getMethod())
                .path(request.getRequestURI())
                .build();
    }

    /**
     * Pushes the caller fields of {@code context} into the MDC until the returned
     * scope is closed.
     */
    public LoggingScope push(RequestContext context) {
        return LoggingScope.push(toLogFields(context));
    }

    public static Map<String, String> toLogFields(RequestContext context) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(TrafficLogEvent.USER_NAME, context.getUserName());
        fields.put(TrafficLogEvent.IP, context.getIp());
        fields.put(TrafficLogEvent.USER_AGENT, context.getUserAgent());
        return fields;
    }

    private String resolveUserName(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal == null || !StringUtils.hasText(principal.getName())) {
            return RequestContext.ANONYMOUS_USER;
        }
        return principal.getName();
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (trustForwardedHeaders) {
            String xForwardedFor = request.getHeader("X-Forwarded-For");
            if (StringUtils.hasText(xForwardedFor)) {
                return xForwardedFor.split(",")[0].trim();
            }

            String xRealIp = request.getHeader("X-Real-IP");
            if (StringUtils.hasText(xRealIp)) {
                return xRealIp.trim();
            }
        }
        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : "";
    }
}
