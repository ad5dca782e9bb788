package com.retail.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DemandForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemandForecastApplication.class, args);
    }
}
