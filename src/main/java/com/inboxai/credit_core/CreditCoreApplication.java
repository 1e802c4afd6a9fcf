package com.inboxai.credit_core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableRetry
public class CreditCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditCoreApplication.class, args);
    }
}
