package com.cargo.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExceptionMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExceptionMonitorApplication.class, args);
    }
}
