package com.example.logrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogRelayApplication.class, args);
    }
}
