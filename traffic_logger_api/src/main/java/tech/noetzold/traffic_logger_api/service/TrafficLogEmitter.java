package tech.noetzold.traffic_logger_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tech.noetzold.traffic_logger_api.CallerContextEnricher;
import tech.noetzold.traffic_logger_api.event.TrafficLogEvent;
import tech.noetzold.traffic_logger_api.event.TrafficTemplate;
import tech.noetzold.traffic_logger_api.model.RequestContext;

import java.util.Map;

@Service
public class TrafficLogEmitter {

    private static final Logger logger = LoggerFactory.getLogger(TrafficLogEmitter.class);

    private final TrafficLogSink sink;

    public TrafficLogEmitter(TrafficLogSink sink) {
        this.sink = sink;
    }

    public void emit(TrafficTemplate template, Map<String, Object> fields, RequestContext context) {
        TrafficLogEvent event = TrafficLogEvent.builder()
                .template(template)
                .fields(fields)
                .context(CallerContextEnricher.toLogFields(context))
                .timestamp(System.currentTimeMillis())
                .build();

        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            logger.warn("Traffic log sink rejected {} for {} {}: {}",
                    template, context.getMethod(), context.getPath(), e.getMessage(), e);
        }
    }
}
