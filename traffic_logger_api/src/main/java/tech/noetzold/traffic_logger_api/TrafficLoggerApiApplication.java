package tech.noetzold.traffic_logger_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TrafficLoggerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrafficLoggerApiApplication.class, args);
    }
}
