package com.rentalrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RentalRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalRiskApplication.class, args);
    }
}
