package com.expertpanel.deliberation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeliberationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeliberationEngineApplication.class, args);
    }
}
