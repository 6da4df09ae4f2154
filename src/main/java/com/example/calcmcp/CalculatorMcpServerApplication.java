package com.example.calcmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalculatorMcpServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalculatorMcpServerApplication.class, args);
    }
}
