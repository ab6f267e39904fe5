package com.eainde.nlg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NlgApplication {

    public static void main(String[] args) {
        SpringApplication.run(NlgApplication.class, args);
    }
}
