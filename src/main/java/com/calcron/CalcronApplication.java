package com.calcron;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CalcronApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(CalcronApplication.class, args);
        if (context.getEnvironment().getProperty("calcron.sync.run-once", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
