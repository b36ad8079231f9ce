package com.openforge.ariste;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AristeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AristeApplication.class, args);
    }
}
