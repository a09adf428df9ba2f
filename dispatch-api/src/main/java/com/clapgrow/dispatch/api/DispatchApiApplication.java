package com.clapgrow.dispatch.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DispatchApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(DispatchApiApplication.class, args);
    }
}
