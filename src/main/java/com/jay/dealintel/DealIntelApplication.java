package com.jay.dealintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DealIntelApplication {
    public static void main(String[] args) {
        SpringApplication.run(DealIntelApplication.class, args);
    }
}
