package com.github.salilvnair.formassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormAssistApplication.class, args);
    }
}
