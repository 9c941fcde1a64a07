package com.hba1cvalidation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Hba1cValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(Hba1cValidationApplication.class, args);
    }
}
