package me.internalizable.authgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuthGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthGateApplication.class, args);
    }
}
