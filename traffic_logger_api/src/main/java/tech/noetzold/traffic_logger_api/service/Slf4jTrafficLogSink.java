package tech.noetzold.traffic_logger_api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.noetzold.traffic_logger_api.LoggingScope;
import tech.noetzold.traffic_logger_api.event.TrafficLogEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes traffic events to the {@code traffic} logger. Template placeholders are
 * replaced with field values; the remaining fields follow the message as JSON.
 */
public class Slf4jTrafficLogSink implements TrafficLogSink {

    static final String LOGGER_NAME = "traffic";

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final ObjectMapper objectMapper;

    public Slf4jTrafficLogSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void accept(TrafficLogEvent event) {
        if (!logger.isInfoEnabled()) {
            return;
        }
        Map<String, Object> extra = new LinkedHashMap<>(event.getFields());
        String message = render(event.getTemplate().getMessageTemplate(), event.getFields(), extra);

        try (LoggingScope ignored = LoggingScope.push(event.getContext())) {
            if (extra.isEmpty()) {
                logger.info(message);
            } else {
                logger.info("{} {}", message, toJson(extra));
            }
        }
    }

    static String render(String template, Map<String, Object> fields, Map<String, Object> unused) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            unused.remove(name);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(fields.get(name))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String toJson(Map<String, Object> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            return fields.toString();
        }
    }
}
