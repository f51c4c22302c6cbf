package com.behindbars.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BehindBarsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BehindBarsApplication.class, args);
    }
}
