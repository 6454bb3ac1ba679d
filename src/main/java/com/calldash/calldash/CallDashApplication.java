package com.calldash.calldash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CallDashApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallDashApplication.class, args);
    }
}
