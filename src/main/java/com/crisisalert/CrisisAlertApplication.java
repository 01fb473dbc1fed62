package com.crisisalert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CrisisAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrisisAlertApplication.class, args);
    }
}
