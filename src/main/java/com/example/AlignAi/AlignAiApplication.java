package com.example.AlignAi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlignAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlignAiApplication.class, args);
    }
}
