package com.example.ticker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeTickerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeTickerApplication.class, args);
    }
}
