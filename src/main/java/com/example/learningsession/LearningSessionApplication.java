package com.example.learningsession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LearningSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LearningSessionApplication.class, args);
    }
}
