package com.tony.baseballStats.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "mlb.api")
@Data
public class MlbApiProperties {
    private String baseUrl = "https://statsapi.mlb.com/api/v1";
    private String season = "2024";
    private String sportId = "1";
    private String rosterType = "active";
}
