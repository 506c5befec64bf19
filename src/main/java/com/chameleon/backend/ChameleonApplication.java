package com.chameleon.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChameleonApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChameleonApplication.class, args);
    }
}
