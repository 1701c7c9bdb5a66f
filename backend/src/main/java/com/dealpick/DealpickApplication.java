package com.dealpick;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DealpickApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealpickApplication.class, args);
    }
}
