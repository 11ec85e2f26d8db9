package com.example.imagestore.config;

import com.example.imagestore.util.ImagePaths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serves images from the public local root at the URLs {@code ImageUrlResolver} hands out.
 * The secure root is never exposed here.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final StorageProperties properties;

    public WebConfig(StorageProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path imagesDir = Paths.get(properties.getLocalRoot()).resolve(ImagePaths.IMAGES_ROOT).toAbsolutePath().normalize();

        // resource locations must be directory URIs ending in a slash
        String location = imagesDir.toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }

        registry.addResourceHandler("/" + ImagePaths.IMAGES_ROOT + "/**")
            .addResourceLocations(location)
            .setCachePeriod(3600);
    }
}
