package com.fincube.fraud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class FraudScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudScoringApplication.class, args);
    }
}
