package com.memeinsight.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemeInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemeInsightApplication.class, args);
    }
}
