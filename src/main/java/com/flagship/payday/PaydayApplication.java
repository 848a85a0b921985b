package com.flagship.payday;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PaydayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaydayApplication.class, args);
    }
}
