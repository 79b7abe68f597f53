package com.example.footprint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FootprintJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FootprintJobsApplication.class, args);
    }
}
