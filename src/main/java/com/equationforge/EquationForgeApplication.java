package com.equationforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EquationForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(EquationForgeApplication.class, args);
    }
}
