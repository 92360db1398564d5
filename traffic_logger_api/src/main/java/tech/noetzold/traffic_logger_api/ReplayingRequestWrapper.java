package tech.noetzold.traffic_logger_api;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.util.MultiValueMap;
import tech.noetzold.traffic_logger_api.buffer.PooledBuffer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request whose body starts over from offset 0: the bytes already captured into a
 * pooled buffer are served first, then whatever the original stream still holds.
 * The buffer stays leased until {@link #releaseBuffer()} is called.
 *
 * <p>Once the body has been read the container no longer parses form posts, so
 * the parameters of an {@code application/x-www-form-urlencoded} POST are rebuilt
 * here from the replayed body and merged after the query string parameters.
 */
public class ReplayingRequestWrapper extends HttpServletRequestWrapper {

    private static final Logger logger = LoggerFactory.getLogger(ReplayingRequestWrapper.class);

    private static final FormHttpMessageConverter formConverter = new FormHttpMessageConverter();

    private final PooledBuffer captured;
    private final int capturedLength;
    private final ServletInputStream remainder;
    private ServletInputStream inputStream;
    private BufferedReader reader;
    private Map<String, String[]> parameters;

    public ReplayingRequestWrapper(HttpServletRequest request, PooledBuffer captured, int capturedLength,
                                   ServletInputStream remainder) {
        super(request);
        this.captured = captured;
        this.capturedLength = capturedLength;
        this.remainder = remainder;
    }

    @Override
    public ServletInputStream getInputStream() {
        if (reader != null) {
            throw new IllegalStateException("getReader() has already been called for this request");
        }
        if (inputStream == null) {
            inputStream = new ReplayingInputStream();
        }
        return inputStream;
    }

    @Override
    public BufferedReader getReader() throws IOException {
        if (inputStream != null) {
            throw new IllegalStateException("getInputStream() has already been called for this request");
        }
        if (reader == null) {
            String encoding = getCharacterEncoding();
            Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.ISO_8859_1;
            reader = new BufferedReader(new InputStreamReader(new ReplayingInputStream(), charset));
        }
        return reader;
    }

    @Override
    public String getParameter(String name) {
        String[] values = getParameterMap().get(name);
        return values != null && values.length > 0 ? values[0] : null;
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        if (!isFormPost()) {
            return super.getParameterMap();
        }
        if (parameters == null) {
            parameters = Collections.unmodifiableMap(mergeFormParameters());
        }
        return parameters;
    }

    @Override
    public Enumeration<String> getParameterNames() {
        return Collections.enumeration(getParameterMap().keySet());
    }

    @Override
    public String[] getParameterValues(String name) {
        return getParameterMap().get(name);
    }

    public void releaseBuffer() {
        captured.close();
    }

    private boolean isFormPost() {
        String contentType = getContentType();
        return contentType != null
                && contentType.contains(MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                && HttpMethod.POST.matches(getMethod());
    }

    private Map<String, String[]> mergeFormParameters() {
        Map<String, String[]> merged = new LinkedHashMap<>(super.getParameterMap());
        MultiValueMap<String, String> form;
        try {
            form = formConverter.read(null, new ReplayedFormMessage());
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not parse form body of {} {}: {}", getMethod(), getRequestURI(), e.getMessage());
            return merged;
        }

        form.forEach((name, values) -> {
            String[] existing = merged.get(name);
            if (existing == null) {
                merged.put(name, values.toArray(new String[0]));
            } else {
                String[] combined = new String[existing.length + values.size()];
                System.arraycopy(existing, 0, combined, 0, existing.length);
                for (int i = 0; i < values.size(); i++) {
                    combined[existing.length + i] = values.get(i);
                }
                merged.put(name, combined);
            }
        });
        return merged;
    }

    private final class ReplayedFormMessage implements HttpInputMessage {

        @Override
        public InputStream getBody() {
            return new ReplayingInputStream();
        }

        @Override
        public HttpHeaders getHeaders() {
            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.CONTENT_TYPE, getContentType());
            return headers;
        }
    }

    private final class ReplayingInputStream extends ServletInputStream {

        private int position;

        @Override
        public int read() throws IOException {
            if (position < capturedLength) {
                return captured.array()[position++] & 0xFF;
            }
            return remainder.read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (position < capturedLength) {
                int count = Math.min(len, capturedLength - position);
                System.arraycopy(captured.array(), position, b, off, count);
                position += count;
                return count;
            }
            return remainder.read(b, off, len);
        }

        @Override
        public int available() throws IOException {
            return (capturedLength - position) + remainder.available();
        }

        @Override
        public boolean isFinished() {
            return position >= capturedLength && remainder.isFinished();
        }

        @Override
        public boolean isReady() {
            return position < capturedLength || remainder.isReady();
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            remainder.setReadListener(readListener);
        }
    }
}
