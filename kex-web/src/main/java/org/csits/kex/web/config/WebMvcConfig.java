package org.csits.kex.web.config;

import lombok.RequiredArgsConstructor;
import org.csits.kex.web.security.CurrentPrincipalResolver;
import org.csits.kex.web.security.PermissionInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final CurrentPrincipalResolver principalResolver;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new PermissionInterceptor(principalResolver))
            .addPathPatterns("/api/export/**");
    }
}
