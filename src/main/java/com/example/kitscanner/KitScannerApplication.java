package com.example.kitscanner;

import com.example.kitscanner.config.KitScannerProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Kit Scanner API",
                version = "1.0",
                description = "REST API for kit checkout, check-in and kit bundling scan stations.",
                contact = @Contact(name = "Kit Scanner")))
@SpringBootApplication
@EnableConfigurationProperties(KitScannerProperties.class)
public class KitScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KitScannerApplication.class, args);
    }
}
