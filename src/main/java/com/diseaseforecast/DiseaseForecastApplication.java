package com.diseaseforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiseaseForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiseaseForecastApplication.class, args);
    }
}
