package tech.noetzold.traffic_logger_api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.DispatcherType;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.traffic_logger_api.buffer.BufferPool;
import tech.noetzold.traffic_logger_api.buffer.SizeClassedBufferPool;
import tech.noetzold.traffic_logger_api.config.TrafficLoggingProperties;
import tech.noetzold.traffic_logger_api.service.CapturePolicy;
import tech.noetzold.traffic_logger_api.service.Slf4jTrafficLogSink;
import tech.noetzold.traffic_logger_api.service.TrafficLogEmitter;
import tech.noetzold.traffic_logger_api.service.TrafficLogSink;

@Configuration
public class TrafficLoggingConfig {

    @Bean
    public CapturePolicy capturePolicy(TrafficLoggingProperties properties) {
        return CapturePolicy.from(properties);
    }

    @Bean
    public BufferPool captureBufferPool(TrafficLoggingProperties properties) {
        TrafficLoggingProperties.BufferPool pool = properties.getBufferPool();
        return new SizeClassedBufferPool(pool.getMaxPooledSize(), pool.getMaxBuffersPerSize());
    }

    @Bean
    public TrafficLogSink slf4jTrafficLogSink(ObjectMapper objectMapper) {
        return new Slf4jTrafficLogSink(objectMapper);
    }

    @Bean
    public FilterRegistrationBean<TrafficLoggingFilter> trafficLoggingFilter(TrafficLoggingProperties properties,
                                                                             CallerContextEnricher contextEnricher,
                                                                             CapturePolicy capturePolicy,
                                                                             BufferPool captureBufferPool,
                                                                             TrafficLogEmitter emitter) {
        TrafficLoggingFilter filter = new TrafficLoggingFilter(
                contextEnricher,
                capturePolicy,
                captureBufferPool,
                emitter,
                properties.getExcludedPaths(),
                properties.getRedactedHeaders());

        FilterRegistrationBean<TrafficLoggingFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("trafficLoggingFilter");
        registration.addUrlPatterns("/*");
        registration.setDispatcherTypes(DispatcherType.REQUEST, DispatcherType.ASYNC);
        registration.setOrder(properties.getFilterOrder());
        return registration;
    }
}
