package tech.noetzold.traffic_logger_api;

import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import tech.noetzold.traffic_logger_api.buffer.SizeClassedBufferPool;
import tech.noetzold.traffic_logger_api.event.TrafficLogEvent;
import tech.noetzold.traffic_logger_api.event.TrafficTemplate;
import tech.noetzold.traffic_logger_api.service.CapturePolicy;
import tech.noetzold.traffic_logger_api.service.TrafficLogEmitter;

import java.io.BufferedReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrafficLoggingFilterTest {

    private final RecordingTrafficLogSink sink = new RecordingTrafficLogSink();
    private final SizeClassedBufferPool bufferPool = new SizeClassedBufferPool(1024 * 1024, 8);

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void capturesSmallRequestBodyAndReplaysItDownstream() throws Exception {
        String body = "{\"client_id\":\"mvc42\",\"grant_type\":\"refresh_token\"}";
        assertThat(body.getBytes(StandardCharsets.UTF_8)).hasSize(50);
        MockHttpServletRequest request = post("/connect/token", body.getBytes(StandardCharsets.UTF_8));
        AtomicReference<byte[]> seen = new AtomicReference<>();

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seen.set(req.getInputStream().readAllBytes()));

        assertThat(sink.templates())
                .containsExactly(TrafficTemplate.REQUEST_CAPTURED, TrafficTemplate.RESPONSE_SKIPPED);
        TrafficLogEvent captured = sink.single(TrafficTemplate.REQUEST_CAPTURED);
        assertThat(captured.getFields())
                .containsEntry(TrafficLogEvent.REQUEST_BODY, body)
                .containsEntry(TrafficLogEvent.REQUEST_METHOD, "POST")
                .containsEntry(TrafficLogEvent.REQUEST_PATH, "/connect/token");
        assertThat(new String(seen.get(), StandardCharsets.UTF_8)).isEqualTo(body);
    }

    @Test
    void requestWithoutContentLengthIsSkippedAndUntouched() throws Exception {
        byte[] body = "grant_type=client_credentials".getBytes(StandardCharsets.UTF_8);
        MockHttpServletRequest request = withDeclaredLength(post("/connect/token", body), -1);
        AtomicReference<byte[]> seen = new AtomicReference<>();

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seen.set(req.getInputStream().readAllBytes()));

        TrafficLogEvent skipped = sink.single(TrafficTemplate.REQUEST_SKIPPED);
        assertThat(skipped.getFields()).doesNotContainKey(TrafficLogEvent.REQUEST_BODY);
        assertThat(seen.get()).isEqualTo(body);
        assertThat(bufferPool.idleCount(body.length)).isZero();
    }

    @Test
    void lengthEqualToLimitIsSkippedAndOneBelowIsCaptured() throws Exception {
        filter(10, 1000).doFilter(post("/a", "0123456789".getBytes(StandardCharsets.UTF_8)),
                new MockHttpServletResponse(), (req, res) -> { });
        filter(10, 1000).doFilter(post("/b", "012345678".getBytes(StandardCharsets.UTF_8)),
                new MockHttpServletResponse(), (req, res) -> { });

        assertThat(sink.templates()).containsExactly(
                TrafficTemplate.REQUEST_SKIPPED, TrafficTemplate.RESPONSE_SKIPPED,
                TrafficTemplate.REQUEST_CAPTURED, TrafficTemplate.RESPONSE_SKIPPED);
        assertThat(sink.single(TrafficTemplate.REQUEST_CAPTURED).getFields())
                .containsEntry(TrafficLogEvent.REQUEST_BODY, "012345678");
    }

    @Test
    void emptyBodyIsSkipped() throws Exception {
        filter(1000, 1000).doFilter(post("/a", new byte[0]), new MockHttpServletResponse(), (req, res) -> { });

        assertThat(sink.templates()).first().isEqualTo(TrafficTemplate.REQUEST_SKIPPED);
    }

    @Test
    void shortReadLogsWhatArrived() throws Exception {
        MockHttpServletRequest request = withDeclaredLength(post("/a", "abcd".getBytes(StandardCharsets.UTF_8)), 10);
        AtomicReference<byte[]> seen = new AtomicReference<>();

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seen.set(req.getInputStream().readAllBytes()));

        assertThat(sink.single(TrafficTemplate.REQUEST_CAPTURED).getFields())
                .containsEntry(TrafficLogEvent.REQUEST_BODY, "abcd");
        assertThat(new String(seen.get(), StandardCharsets.UTF_8)).isEqualTo("abcd");
    }

    @Test
    void invalidUtf8IsReplacedInsteadOfFailing() throws Exception {
        byte[] body = {'a', (byte) 0xFF, 'b'};
        AtomicReference<byte[]> seen = new AtomicReference<>();

        filter(1000, 1000).doFilter(post("/a", body), new MockHttpServletResponse(),
                (req, res) -> seen.set(req.getInputStream().readAllBytes()));

        assertThat(sink.single(TrafficTemplate.REQUEST_CAPTURED).getFields())
                .containsEntry(TrafficLogEvent.REQUEST_BODY, "a\uFFFDb");
        assertThat(seen.get()).isEqualTo(body);
    }

    @Test
    void downstreamCanUseReaderOnCapturedBody() throws Exception {
        String body = "{\"name\":\"Zoë\"}";
        MockHttpServletRequest request = post("/a", body.getBytes(StandardCharsets.UTF_8));
        request.setCharacterEncoding("UTF-8");
        AtomicReference<String> seen = new AtomicReference<>();

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            BufferedReader reader = req.getReader();
            seen.set(reader.lines().collect(Collectors.joining("\n")));
        });

        assertThat(seen.get()).isEqualTo(body);
        assertThat(sink.single(TrafficTemplate.REQUEST_CAPTURED).getFields())
                .containsEntry(TrafficLogEvent.REQUEST_BODY, body);
    }

    @Test
    void capturedBufferGoesBackToThePool() throws Exception {
        filter(1000, 1000).doFilter(post("/a", new byte[100]), new MockHttpServletResponse(), (req, res) -> { });

        assertThat(bufferPool.idleCount(100)).isEqualTo(1);
    }

    @Test
    void capturesResponseAndStillDeliversIt() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        byte[] payload = "{\"access_token\":\"abc\"}".getBytes(StandardCharsets.UTF_8);

        filter(1000, 1000).doFilter(new MockHttpServletRequest("GET", "/userinfo"), response, (req, res) -> {
            ((HttpServletResponse) res).setStatus(200);
            res.getOutputStream().write(payload);
        });

        TrafficLogEvent captured = sink.single(TrafficTemplate.RESPONSE_CAPTURED);
        assertThat(captured.getFields())
                .containsEntry(TrafficLogEvent.RESPONSE_BODY, "{\"access_token\":\"abc\"}")
                .containsEntry(TrafficLogEvent.STATUS_CODE, 200)
                .containsEntry(TrafficLogEvent.REQUEST_METHOD, "GET")
                .containsEntry(TrafficLogEvent.REQUEST_PATH, "/userinfo");
        assertThat(response.getContentAsByteArray()).isEqualTo(payload);
    }

    @Test
    void oversizedResponseIsSkippedButDelivered() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        byte[] payload = new byte[20];

        filter(1000, 20).doFilter(new MockHttpServletRequest("GET", "/a"), response,
                (req, res) -> res.getOutputStream().write(payload));

        assertThat(sink.single(TrafficTemplate.RESPONSE_SKIPPED).getFields())
                .doesNotContainKey(TrafficLogEvent.RESPONSE_BODY);
        assertThat(response.getContentAsByteArray()).hasSize(20);
    }

    @Test
    void emptyServerErrorResponseIsSkippedWithStatus() throws Exception {
        filter(1000, 1000).doFilter(new MockHttpServletRequest("GET", "/a"), new MockHttpServletResponse(),
                (req, res) -> ((HttpServletResponse) res).setStatus(500));

        assertThat(sink.single(TrafficTemplate.RESPONSE_SKIPPED).getFields())
                .containsEntry(TrafficLogEvent.STATUS_CODE, 500);
    }

    @Test
    void downstreamFailureIsPropagatedAfterResponseEvent() {
        FilterChain failing = (req, res) -> {
            req.getInputStream().readAllBytes();
            throw new ServletException("handler blew up");
        };

        assertThatThrownBy(() -> filter(1000, 1000).doFilter(post("/a", new byte[64]),
                new MockHttpServletResponse(), failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("handler blew up");

        assertThat(sink.templates())
                .containsExactly(TrafficTemplate.REQUEST_CAPTURED, TrafficTemplate.RESPONSE_SKIPPED);
        assertThat(sink.single(TrafficTemplate.RESPONSE_SKIPPED).getFields())
                .containsEntry(TrafficLogEvent.STATUS_CODE, 500)
                .containsEntry(TrafficLogEvent.ERROR, ServletException.class.getName());
        assertThat(MDC.get("UserName")).isNull();
        assertThat(bufferPool.idleCount(64)).isEqualTo(1);
    }

    @Test
    void disabledCaptureStillEmitsBothPhases() throws Exception {
        TrafficLoggingFilter filter = filter(new CapturePolicy(false, 1000, false, 1000));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(post("/a", "abc".getBytes(StandardCharsets.UTF_8)), response,
                (req, res) -> res.getOutputStream().write("ok".getBytes(StandardCharsets.UTF_8)));

        assertThat(sink.templates())
                .containsExactly(TrafficTemplate.REQUEST_SKIPPED, TrafficTemplate.RESPONSE_SKIPPED);
        assertThat(response.getContentAsString()).isEqualTo("ok");
    }

    @Test
    void headersAreFlattenedAndSensitiveOnesRedacted() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/a");
        request.addHeader("Accept", "text/html");
        request.addHeader("Accept", "application/json");
        request.addHeader("Authorization", "Bearer secret");

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(), (req, res) -> { });

        @SuppressWarnings("unchecked")
        Map<String, String> headers = (Map<String, String>) sink.single(TrafficTemplate.REQUEST_SKIPPED)
                .getFields().get(TrafficLogEvent.REQUEST_HEADERS);
        assertThat(headers)
                .containsEntry("Accept", "text/html,application/json")
                .containsEntry("Authorization", TrafficLoggingFilter.REDACTED);
    }

    @Test
    void callerFieldsAreAmbientDuringDownstreamAndAttachedToEvents() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/a");
        request.setRemoteAddr("10.9.8.7");
        request.addHeader("User-Agent", "probe/1.0");
        AtomicReference<Map<String, String>> ambient = new AtomicReference<>();

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(),
                (req, res) -> ambient.set(MDC.getCopyOfContextMap()));

        assertThat(ambient.get())
                .containsEntry("UserName", "*")
                .containsEntry("IP", "10.9.8.7")
                .containsEntry("UserAgent", "probe/1.0");
        for (TrafficLogEvent event : sink.events()) {
            assertThat(event.getContext()).isEqualTo(ambient.get());
        }
        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }

    @Test
    void excludedPathsProduceNoEvents() throws Exception {
        filter(1000, 1000).doFilter(new MockHttpServletRequest("GET", "/actuator/health"),
                new MockHttpServletResponse(), (req, res) -> { });
        filter(1000, 1000).doFilter(new MockHttpServletRequest("GET", "/health"),
                new MockHttpServletResponse(), (req, res) -> { });

        assertThat(sink.events()).isEmpty();
    }

    @Test
    void formParametersAreRebuiltFromCapturedBody() throws Exception {
        MockHttpServletRequest request = post("/connect/token",
                "grant_type=client_credentials&scope=api".getBytes(StandardCharsets.UTF_8));
        request.setContentType("application/x-www-form-urlencoded");
        request.setQueryString("scope=openid");
        request.addParameter("scope", "openid");
        AtomicReference<String> grant = new AtomicReference<>();
        AtomicReference<String[]> scopes = new AtomicReference<>();

        filter(1000, 1000).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            grant.set(req.getParameter("grant_type"));
            scopes.set(req.getParameterValues("scope"));
        });

        assertThat(grant.get()).isEqualTo("client_credentials");
        assertThat(scopes.get()).containsExactly("openid", "api");
        assertThat(sink.single(TrafficTemplate.REQUEST_CAPTURED).getFields())
                .containsEntry(TrafficLogEvent.REQUEST_BODY, "grant_type=client_credentials&scope=api");
    }

    @Test
    void asyncResponseIsLoggedAndDeliveredOnTheLastDispatch() throws Exception {
        TrafficLoggingFilter filter = filter(1000, 1000);
        MockHttpServletRequest request = post("/async", "ping".getBytes(StandardCharsets.UTF_8));
        request.setAsyncSupported(true);
        request.addHeader("User-Agent", "async-client");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<ServletResponse> dispatchedResponse = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            dispatchedResponse.set(res);
            req.startAsync(req, res);
        });

        assertThat(sink.templates()).containsExactly(TrafficTemplate.REQUEST_CAPTURED);
        assertThat(response.getContentAsByteArray()).isEmpty();
        assertThat(bufferPool.idleCount(4)).isZero();

        request.setAsyncStarted(false);
        request.setDispatcherType(DispatcherType.ASYNC);
        AtomicReference<String> ambientUserAgent = new AtomicReference<>();
        filter.doFilter(request, dispatchedResponse.get(), (req, res) -> {
            ambientUserAgent.set(MDC.get("UserAgent"));
            res.getOutputStream().write("async-ok".getBytes(StandardCharsets.UTF_8));
        });

        assertThat(sink.templates())
                .containsExactly(TrafficTemplate.REQUEST_CAPTURED, TrafficTemplate.RESPONSE_CAPTURED);
        assertThat(sink.single(TrafficTemplate.RESPONSE_CAPTURED).getFields())
                .containsEntry(TrafficLogEvent.RESPONSE_BODY, "async-ok");
        assertThat(sink.single(TrafficTemplate.RESPONSE_CAPTURED).getContext())
                .containsEntry(TrafficLogEvent.USER_AGENT, "async-client");
        assertThat(ambientUserAgent.get()).isEqualTo("async-client");
        assertThat(response.getContentAsString()).isEqualTo("async-ok");
        assertThat(bufferPool.idleCount(4)).isEqualTo(1);
        assertThat(request.getAttribute(TrafficLoggingFilter.EXCHANGE_ATTRIBUTE)).isNull();
    }

    @Test
    void emptyExclusionListLogsHealthRequests() throws Exception {
        TrafficLoggingFilter filter = new TrafficLoggingFilter(
                new CallerContextEnricher(TrafficLoggingPropertiesFixtures.capture(1000, 1000, false)),
                new CapturePolicy(true, 1000, true, 1000),
                bufferPool,
                new TrafficLogEmitter(sink),
                List.of(),
                List.of());

        filter.doFilter(new MockHttpServletRequest("GET", "/health"), new MockHttpServletResponse(), (req, res) -> { });

        assertThat(sink.templates())
                .containsExactly(TrafficTemplate.REQUEST_SKIPPED, TrafficTemplate.RESPONSE_SKIPPED);
    }

    private TrafficLoggingFilter filter(int requestMax, int responseMax) {
        return filter(new CapturePolicy(true, requestMax, true, responseMax));
    }

    private TrafficLoggingFilter filter(CapturePolicy policy) {
        return new TrafficLoggingFilter(
                new CallerContextEnricher(TrafficLoggingPropertiesFixtures.capture(1000, 1000, false)),
                policy,
                bufferPool,
                new TrafficLogEmitter(sink),
                List.of("/actuator/**", "/health"),
                List.of("Authorization", "Cookie"));
    }

    private static MockHttpServletRequest post(String path, byte[] body) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setContent(body);
        return request;
    }

    private static MockHttpServletRequest withDeclaredLength(MockHttpServletRequest source, long declared) {
        MockHttpServletRequest request = new MockHttpServletRequest(source.getMethod(), source.getRequestURI()) {
            @Override
            public int getContentLength() {
                return (int) declared;
            }

            @Override
            public long getContentLengthLong() {
                return declared;
            }
        };
        request.setContent(source.getContentAsByteArray());
        return request;
    }
}
