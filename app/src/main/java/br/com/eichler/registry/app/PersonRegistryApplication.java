package br.com.eichler.registry.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "br.com.eichler.registry")
public class PersonRegistryApplication {
    public static void main(String[] args) {
        SpringApplication.run(PersonRegistryApplication.class, args);
    }
}
