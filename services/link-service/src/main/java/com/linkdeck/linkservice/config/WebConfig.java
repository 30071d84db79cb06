package com.linkdeck.linkservice.config;

import com.linkdeck.linkservice.infrastructure.web.AuthContextArgumentResolver;
import com.linkdeck.linkservice.infrastructure.web.AuthorizationMiddleware;
import com.linkdeck.linkservice.infrastructure.web.OrgPermissionInterceptor;
import com.linkdeck.linkservice.infrastructure.web.SessionInterceptor;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, the authorization interceptors and the {@code AuthContext}
 * argument resolver.
 *
 * <p>The session interceptor is registered before the permission interceptor, so a request is
 * always authenticated before its permission is checked.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthorizationMiddleware middleware;

    public WebConfig(AuthorizationMiddleware middleware) {
        this.middleware = middleware;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local frontends only; production origins come from the deployment.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new SessionInterceptor(middleware)).addPathPatterns("/api/**").order(0);
        registry.addInterceptor(new OrgPermissionInterceptor(middleware)).addPathPatterns("/api/**").order(1);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new AuthContextArgumentResolver());
    }
}
