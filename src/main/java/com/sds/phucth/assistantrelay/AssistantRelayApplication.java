package com.sds.phucth.assistantrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssistantRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistantRelayApplication.class, args);
    }
}
