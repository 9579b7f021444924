package com.fillline.scheduler;

import com.fillline.scheduler.config.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SchedulerProperties.class)
public class FillSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FillSchedulerApplication.class, args);
    }
}
