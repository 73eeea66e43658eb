package com.elssolution.insteonbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class InsteonBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsteonBridgeApplication.class, args);
    }

}
