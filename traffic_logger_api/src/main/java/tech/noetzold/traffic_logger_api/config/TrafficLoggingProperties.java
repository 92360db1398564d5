package tech.noetzold.traffic_logger_api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Settings of the traffic logging filter, bound once at startup from
 * {@code application.logging-middleware.*}.
 *
 * <p>The four capture settings have no defaults: a missing or malformed value
 * fails the application context instead of silently disabling capture.
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "application.logging-middleware")
public class TrafficLoggingProperties {

    @NotNull
    private final Boolean logRequestBody;

    @NotNull
    @PositiveOrZero
    private final Integer logRequestBodyMaxSize;

    @NotNull
    private final Boolean logResponseBody;

    @NotNull
    @PositiveOrZero
    private final Integer logResponseBodyMaxSize;

    private final int filterOrder;

    /**
     * Ant patterns of paths the traffic filter does not run for. Requests matching
     * one of them produce neither a request event nor a response event. Defaults to
     * {@code /actuator/**} and {@code /health}; set an empty list to log every request.
     */
    private final List<String> excludedPaths;

    private final List<String> redactedHeaders;

    private final boolean trustForwardedHeaders;

    @Valid
    private final BufferPool bufferPool;

    public TrafficLoggingProperties(Boolean logRequestBody,
                                    Integer logRequestBodyMaxSize,
                                    Boolean logResponseBody,
                                    Integer logResponseBodyMaxSize,
                                    @DefaultValue("1") int filterOrder,
                                    @DefaultValue({"/actuator/**", "/health"}) List<String> excludedPaths,
                                    @DefaultValue({"Authorization", "Cookie", "Proxy-Authorization"}) List<String> redactedHeaders,
                                    @DefaultValue("false") boolean trustForwardedHeaders,
                                    @DefaultValue BufferPool bufferPool) {
        this.logRequestBody = logRequestBody;
        this.logRequestBodyMaxSize = logRequestBodyMaxSize;
        this.logResponseBody = logResponseBody;
        this.logResponseBodyMaxSize = logResponseBodyMaxSize;
        this.filterOrder = filterOrder;
        this.excludedPaths = List.copyOf(excludedPaths);
        this.redactedHeaders = List.copyOf(redactedHeaders);
        this.trustForwardedHeaders = trustForwardedHeaders;
        this.bufferPool = bufferPool;
    }

    @Getter
    public static class BufferPool {

        @Positive
        private final int maxPooledSize;

        @Positive
        private final int maxBuffersPerSize;

        public BufferPool(@DefaultValue("1048576") int maxPooledSize,
                          @DefaultValue("32") int maxBuffersPerSize) {
            this.maxPooledSize = maxPooledSize;
            this.maxBuffersPerSize = maxBuffersPerSize;
        }
    }
}
