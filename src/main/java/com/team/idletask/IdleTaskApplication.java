package com.team.idletask;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdleTaskApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdleTaskApplication.class, args);
    }
}
