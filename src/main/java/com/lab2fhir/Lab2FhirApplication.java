package com.lab2fhir;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Lab2FhirApplication {

    public static void main(String[] args) {
        SpringApplication.run(Lab2FhirApplication.class, args);
    }
}
