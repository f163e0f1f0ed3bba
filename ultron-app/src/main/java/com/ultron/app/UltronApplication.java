package com.ultron.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Ultron gateway application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.ultron")
public class UltronApplication {

    public static void main(String[] args) {
        SpringApplication.run(UltronApplication.class, args);
    }
}
