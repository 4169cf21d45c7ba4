package com.fvgscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FvgScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FvgScannerApplication.class, args);
    }
}
