package com.infinitecanvas.canvasbackend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final CanvasProperties properties;

    public CorsConfig(CanvasProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry reg) {
        var patterns = properties.cors().allowedOrigins().toArray(String[]::new);
        reg.addMapping("/api/**")
                .allowedOriginPatterns(patterns)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
