package com.project.image.bgremover.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Maps /uploads/** and /processed/** to the directories configured for StorageService, so the
 * URLs work regardless of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    @Value("${app.upload.dir:uploads}")
    private String uploadDir;

    @Value("${app.processed.dir:processed}")
    private String processedDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(location(uploadDir));
        registry.addResourceHandler("/processed/**")
                .addResourceLocations(location(processedDir));
    }

    private static String location(String dir) {
        Path abs = Paths.get(dir).toAbsolutePath().normalize();
        return "file:" + abs + "/";
    }
}
