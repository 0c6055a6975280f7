package com.prizeflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrizeflowApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrizeflowApplication.class, args);
    }
}
