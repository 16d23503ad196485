package com.dashboard.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.distribution")
public class DistributionConfig {

    private boolean enabled = true;

    private String subjectPrefix = "[Insights]";

    // Used when a request names no recipients
    private List<String> defaultRecipients = new ArrayList<>();
}
