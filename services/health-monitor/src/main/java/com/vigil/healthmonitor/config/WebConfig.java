package com.vigil.healthmonitor.config;

import com.vigil.healthmonitor.infrastructure.web.CorrelationIdFilter;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the admin dashboard, which reads issues and agent runs from the browser. Only reads
 * and the issue lifecycle POSTs are allowed; the correlation header is exposed so the dashboard
 * can quote it in bug reports.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final List<String> dashboardOrigins;

    public WebConfig(
            @Value("${vigil.dashboard.origins:http://localhost:3000,http://localhost:5173}")
                    List<String> dashboardOrigins) {
        this.dashboardOrigins = List.copyOf(dashboardOrigins);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(dashboardOrigins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER)
                .allowCredentials(true)
                .maxAge(1800);
    }
}
