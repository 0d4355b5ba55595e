package com.lelantos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LelantosApplication {

    public static void main(String[] args) {
        SpringApplication.run(LelantosApplication.class, args);
    }
}
