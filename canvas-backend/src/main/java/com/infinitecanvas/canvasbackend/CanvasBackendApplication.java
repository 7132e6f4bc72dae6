package com.infinitecanvas.canvasbackend;

import com.infinitecanvas.canvasbackend.config.CanvasProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CanvasProperties.class)
public class CanvasBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CanvasBackendApplication.class, args);
    }
}
