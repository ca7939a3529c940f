package com.lntracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LnTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LnTrackerApplication.class, args);
    }
}
