package com.example.compliance.declarationservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeclarationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeclarationServiceApplication.class, args);
    }
}
