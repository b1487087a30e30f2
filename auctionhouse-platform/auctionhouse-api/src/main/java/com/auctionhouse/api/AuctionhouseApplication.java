package com.auctionhouse.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Auctionhouse Platform Application
 *
 * Multi-format sale and auction engine for tokenized assets.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.auctionhouse")
public class AuctionhouseApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuctionhouseApplication.class, args);
    }
}
