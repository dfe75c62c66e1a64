package com.cipherline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CipherlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CipherlineApplication.class, args);
    }
}
