package com.flagship.flight_surety;

import com.flagship.flight_surety.config.SuretyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(SuretyProperties.class)
@EnableScheduling
public class FlightSuretyApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlightSuretyApplication.class, args);
    }
}
