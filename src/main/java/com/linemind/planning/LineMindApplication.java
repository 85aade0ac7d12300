package com.linemind.planning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LineMindApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineMindApplication.class, args);
    }
}
