package com.logicloop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogicLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogicLoopApplication.class, args);
    }
}
