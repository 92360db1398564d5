package tech.noetzold.traffic_logger_api.service;

import tech.noetzold.traffic_logger_api.event.TrafficLogEvent;

/**
 * Destination of traffic log events. Delivery guarantees belong to the implementation.
 */
public interface TrafficLogSink {

    void accept(TrafficLogEvent event);
}
