package com.travelrevenue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TravelRevenueApplication {

    public static void main(String[] args) {
        SpringApplication.run(TravelRevenueApplication.class, args);
    }
}
