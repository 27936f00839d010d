package com.airouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiRouterApplication {
    public static void main(String[] args) {
        SpringApplication.run(AiRouterApplication.class, args);
    }
}
