package com.jreinhal.docguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocGuardApplication.class, args);
    }
}
