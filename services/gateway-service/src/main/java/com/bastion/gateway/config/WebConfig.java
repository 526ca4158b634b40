package com.bastion.gateway.config;

import com.bastion.admission.AdmissionPipeline;
import com.bastion.gateway.infrastructure.web.AdmissionContextArgumentResolver;
import com.bastion.gateway.infrastructure.web.AdmissionInterceptor;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: admission on {@code /api/**} and CORS for local frontends.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AdmissionPipeline admissionPipeline;

    public WebConfig(AdmissionPipeline admissionPipeline) {
        this.admissionPipeline = admissionPipeline;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdmissionInterceptor(admissionPipeline)).addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new AdmissionContextArgumentResolver());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Production origins come from the deployment's own CORS layer.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Retry-After", "X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
