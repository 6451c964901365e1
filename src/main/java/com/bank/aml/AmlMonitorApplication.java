package com.bank.aml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AmlMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmlMonitorApplication.class, args);
    }
}
