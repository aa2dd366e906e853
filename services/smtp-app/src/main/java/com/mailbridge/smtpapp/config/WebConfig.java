package com.mailbridge.smtpapp.config;

import com.mailbridge.smtpapp.infrastructure.web.ProcedureContextArgumentResolver;
import com.mailbridge.smtpapp.infrastructure.web.ProtectedProcedureInterceptor;
import com.mailbridge.smtpapp.pipeline.ProcedurePipeline;
import com.mailbridge.smtpapp.sync.WebhookSyncHook;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the dashboard, the protected procedure interceptor and the
 * resolver handing its context to controllers.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ProcedurePipeline pipeline;
    private final WebhookSyncHook webhookSyncHook;

    public WebConfig(ProcedurePipeline pipeline, WebhookSyncHook webhookSyncHook) {
        this.pipeline = pipeline;
        this.webhookSyncHook = webhookSyncHook;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // tenant dashboards live on arbitrary origins
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ProtectedProcedureInterceptor(pipeline, webhookSyncHook))
                .addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new ProcedureContextArgumentResolver());
    }
}
