package com.piacp.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * pi-acp bridge entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.piacp")
public class PiAcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(PiAcpApplication.class, args);
    }
}
