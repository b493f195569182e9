package com.flagship.vote_escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VoteEscrowApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoteEscrowApplication.class, args);
    }
}
