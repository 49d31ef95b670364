package com.herzen.morphius;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MorphiusApplication {
    public static void main(String[] args) {
        SpringApplication.run(MorphiusApplication.class, args);
    }
}
