package com.streamrelay.streamrelay.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RequestLoggingInterceptor requestLoggingInterceptor;
    private final StorageProperties storageProperties;

    public WebConfig(RequestLoggingInterceptor requestLoggingInterceptor, StorageProperties storageProperties) {
        this.requestLoggingInterceptor = requestLoggingInterceptor;
        this.storageProperties = storageProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("*");
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestLoggingInterceptor);
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // Local recordings are served as flat files; URLs from the local backend point here
        String location = Paths.get(storageProperties.getLocal().getRecordingsPath())
                .toAbsolutePath()
                .normalize()
                .toUri()
                .toString();
        registry
                .addResourceHandler("/recordings/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
