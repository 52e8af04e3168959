package com.example.autoschedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoScheduleApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoScheduleApplication.class, args);
    }
}
