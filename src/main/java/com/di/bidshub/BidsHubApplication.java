package com.di.bidshub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BidsHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(BidsHubApplication.class, args);
    }
}
