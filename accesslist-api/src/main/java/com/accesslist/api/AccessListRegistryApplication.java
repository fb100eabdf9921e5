package com.accesslist.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Access List Registry.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.accesslist.api",
    "com.accesslist.engine"
})
public class AccessListRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessListRegistryApplication.class, args);
    }
}
