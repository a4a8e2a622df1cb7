package com.demo.sendguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SendGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SendGuardApplication.class, args);
    }
}
