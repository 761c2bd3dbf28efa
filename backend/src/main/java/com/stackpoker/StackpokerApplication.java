package com.stackpoker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StackpokerApplication {
    public static void main(String[] args) {
        SpringApplication.run(StackpokerApplication.class, args);
    }
}
