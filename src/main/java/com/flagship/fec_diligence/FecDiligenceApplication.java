package com.flagship.fec_diligence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FecDiligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FecDiligenceApplication.class, args);
    }
}
