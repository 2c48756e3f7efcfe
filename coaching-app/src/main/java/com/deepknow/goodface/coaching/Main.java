package com.deepknow.goodface.coaching;

import org.apache.dubbo.config.spring.context.annotation.EnableDubbo;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@EnableDubbo(scanBasePackages = "com.deepknow.goodface.coaching.service")
public class Main {
    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }
}
