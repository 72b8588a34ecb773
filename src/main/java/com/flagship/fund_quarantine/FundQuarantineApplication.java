package com.flagship.fund_quarantine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FundQuarantineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundQuarantineApplication.class, args);
    }
}
