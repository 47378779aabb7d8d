package com.agrichain.offchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class OffchainApplication {

    public static void main(String[] args) {
        SpringApplication.run(OffchainApplication.class, args);
    }
}
