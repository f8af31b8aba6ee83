package com.len.kitchen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class KitchenDisplayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(KitchenDisplayServiceApplication.class, args);
    }

}
