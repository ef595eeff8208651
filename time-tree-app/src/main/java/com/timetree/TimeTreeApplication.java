package com.timetree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeTreeApplication.class, args);
    }
}
