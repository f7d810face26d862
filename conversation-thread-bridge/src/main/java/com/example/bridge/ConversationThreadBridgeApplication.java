package com.example.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ConversationThreadBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConversationThreadBridgeApplication.class, args);
    }
}
