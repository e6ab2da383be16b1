package com.example.formulamap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormulaMapApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaMapApplication.class, args);
    }
}
