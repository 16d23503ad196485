package com.dashboard.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class DashboardInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardInsightsApplication.class, args);
    }
}
