package com.transparenta.analytics;

import com.transparenta.analytics.config.AnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AnalyticsProperties.class)
public class BudgetAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetAnalyticsApplication.class, args);
    }
}
