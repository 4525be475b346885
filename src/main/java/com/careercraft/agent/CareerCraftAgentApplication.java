package com.careercraft.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CareerCraftAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(CareerCraftAgentApplication.class, args);
    }
}
