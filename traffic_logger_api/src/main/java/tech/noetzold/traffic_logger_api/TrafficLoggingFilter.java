package tech.noetzold.traffic_logger_api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.WebUtils;
import tech.noetzold.traffic_logger_api.buffer.BufferPool;
import tech.noetzold.traffic_logger_api.buffer.PooledBuffer;
import tech.noetzold.traffic_logger_api.event.TrafficLogEvent;
import tech.noetzold.traffic_logger_api.event.TrafficTemplate;
import tech.noetzold.traffic_logger_api.model.RequestContext;
import tech.noetzold.traffic_logger_api.service.CapturePolicy;
import tech.noetzold.traffic_logger_api.service.TrafficLogEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logs every request passing through the handler chain: one request event before
 * the chain runs and one response event after it returns. Bodies are captured
 * only when enabled and below the configured size limits.
 *
 * <p>For async handlers the chain returns before the response exists, so the
 * exchange is parked in a request attribute and completed on the last async dispatch.
 */
public class TrafficLoggingFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(TrafficLoggingFilter.class);

    static final String REDACTED = "[REDACTED]";

    static final String EXCHANGE_ATTRIBUTE = TrafficLoggingFilter.class.getName() + ".EXCHANGE";

    private final CallerContextEnricher contextEnricher;
    private final CapturePolicy capturePolicy;
    private final BufferPool bufferPool;
    private final TrafficLogEmitter emitter;
    private final List<String> excludedPaths;
    private final Set<String> redactedHeaders;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public TrafficLoggingFilter(CallerContextEnricher contextEnricher,
                                CapturePolicy capturePolicy,
                                BufferPool bufferPool,
                                TrafficLogEmitter emitter,
                                List<String> excludedPaths,
                                List<String> redactedHeaders) {
        this.contextEnricher = contextEnricher;
        this.capturePolicy = capturePolicy;
        this.bufferPool = bufferPool;
        this.emitter = emitter;
        this.excludedPaths = List.copyOf(excludedPaths);
        this.redactedHeaders = redactedHeaders.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        for (String pattern : excludedPaths) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        if (isAsyncDispatch(request)) {
            resumeExchange(request, response, chain);
            return;
        }

        RequestContext context = contextEnricher.resolve(request);

        try (LoggingScope ignored = contextEnricher.push(context)) {
            HttpServletRequest forwardedRequest = logRequest(request, context);
            ContentCachingResponseWrapper cachedResponse = new ContentCachingResponseWrapper(response);
            Exchange exchange = new Exchange(context, forwardedRequest, cachedResponse);

            runChain(forwardedRequest, cachedResponse, chain, exchange);
        }
    }

    private void resumeExchange(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        Exchange exchange = (Exchange) request.getAttribute(EXCHANGE_ATTRIBUTE);
        if (exchange == null) {
            chain.doFilter(request, response);
            return;
        }

        try (LoggingScope ignored = contextEnricher.push(exchange.context)) {
            runChain(request, response, chain, exchange);
        }
    }

    /**
     * Runs the rest of the chain. While the request is in async mode the response
     * event, the body copy and the buffer release wait for the last async dispatch.
     */
    private void runChain(HttpServletRequest request, HttpServletResponse response, FilterChain chain,
                          Exchange exchange) throws ServletException, IOException {

        boolean suspended = false;
        try {
            chain.doFilter(request, response);
            suspended = request.isAsyncStarted();
        } catch (IOException | ServletException | RuntimeException e) {
            logFailedResponse(exchange.context, e);
            throw e;
        } finally {
            if (suspended) {
                request.setAttribute(EXCHANGE_ATTRIBUTE, exchange);
            } else {
                request.removeAttribute(EXCHANGE_ATTRIBUTE);
                exchange.releaseBuffer();
            }
        }

        if (suspended) {
            return;
        }

        ContentCachingResponseWrapper cachedResponse =
                WebUtils.getNativeResponse(response, ContentCachingResponseWrapper.class);
        if (cachedResponse == null) {
            cachedResponse = exchange.cachedResponse;
        }
        logResponse(cachedResponse, exchange.context);
        cachedResponse.copyBodyToResponse();
    }

    private HttpServletRequest logRequest(HttpServletRequest request, RequestContext context) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TrafficLogEvent.REQUEST_METHOD, context.getMethod());
        fields.put(TrafficLogEvent.REQUEST_PATH, context.getPath());
        fields.put(TrafficLogEvent.REQUEST_HEADERS, extractHeaders(request));

        long contentLength = request.getContentLengthLong();
        if (!capturePolicy.shouldCaptureRequest(contentLength)) {
            emitter.emit(TrafficTemplate.REQUEST_SKIPPED, fields, context);
            return request;
        }

        int length = (int) contentLength;
        PooledBuffer buffer = bufferPool.lease(length);
        try {
            ServletInputStream body = request.getInputStream();
            int read = readUpTo(body, buffer.array(), length, context);
            if (read < length) {
                logger.debug("Request body shorter than declared for {} {}: {} of {} bytes",
                        context.getMethod(), context.getPath(), read, length);
            }

            fields.put(TrafficLogEvent.REQUEST_BODY, new String(buffer.array(), 0, read, StandardCharsets.UTF_8));
            emitter.emit(TrafficTemplate.REQUEST_CAPTURED, fields, context);

            return new ReplayingRequestWrapper(request, buffer, read, body);
        } catch (IOException | RuntimeException e) {
            buffer.close();
            logger.warn("Could not open request body of {} {}: {}", context.getMethod(), context.getPath(),
                    e.getMessage());
            emitter.emit(TrafficTemplate.REQUEST_SKIPPED, fields, context);
            return request;
        }
    }

    private int readUpTo(ServletInputStream body, byte[] target, int length, RequestContext context) {
        int total = 0;
        try {
            while (total < length) {
                int count = body.read(target, total, length - total);
                if (count == -1) {
                    break;
                }
                total += count;
            }
        } catch (IOException e) {
            logger.warn("Request body read failed for {} {} after {} bytes: {}",
                    context.getMethod(), context.getPath(), total, e.getMessage());
        }
        return total;
    }

    private void logResponse(ContentCachingResponseWrapper response, RequestContext context) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TrafficLogEvent.REQUEST_METHOD, context.getMethod());
        fields.put(TrafficLogEvent.REQUEST_PATH, context.getPath());
        fields.put(TrafficLogEvent.STATUS_CODE, response.getStatus());

        if (capturePolicy.shouldCaptureResponse(response.getContentSize())) {
            fields.put(TrafficLogEvent.RESPONSE_BODY,
                    new String(response.getContentAsByteArray(), StandardCharsets.UTF_8));
            emitter.emit(TrafficTemplate.RESPONSE_CAPTURED, fields, context);
        } else {
            emitter.emit(TrafficTemplate.RESPONSE_SKIPPED, fields, context);
        }
    }

    private void logFailedResponse(RequestContext context, Exception failure) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TrafficLogEvent.REQUEST_METHOD, context.getMethod());
        fields.put(TrafficLogEvent.REQUEST_PATH, context.getPath());
        fields.put(TrafficLogEvent.STATUS_CODE, HttpStatus.INTERNAL_SERVER_ERROR.value());
        fields.put(TrafficLogEvent.ERROR, failure.getClass().getName());
        emitter.emit(TrafficTemplate.RESPONSE_SKIPPED, fields, context);
    }

    private Map<String, String> extractHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (request.getHeaderNames() == null) {
            return headers;
        }
        for (String name : Collections.list(request.getHeaderNames())) {
            if (redactedHeaders.contains(name.toLowerCase(Locale.ROOT))) {
                headers.put(name, REDACTED);
            } else {
                headers.put(name, String.join(",", Collections.list(request.getHeaders(name))));
            }
        }
        return headers;
    }

    private static final class Exchange {
        private final RequestContext context;
        private final HttpServletRequest forwardedRequest;
        private final ContentCachingResponseWrapper cachedResponse;

        private Exchange(RequestContext context, HttpServletRequest forwardedRequest,
                         ContentCachingResponseWrapper cachedResponse) {
            this.context = context;
            this.forwardedRequest = forwardedRequest;
            this.cachedResponse = cachedResponse;
        }

        private void releaseBuffer() {
            if (forwardedRequest instanceof ReplayingRequestWrapper) {
                ((ReplayingRequestWrapper) forwardedRequest).releaseBuffer();
            }
        }
    }
}
