package com.agilab.log_collecting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogCollectingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogCollectingApplication.class, args);
    }
}
