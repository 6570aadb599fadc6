package com.sosapp.emergency.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "sos.security")
@Data
public class SecurityProperties {

    private Cors cors = new Cors();
    private boolean publicHealthEndpoint = true;

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = List.of("GET", "POST", "PUT", "OPTIONS");
    }
}
