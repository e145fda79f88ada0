package com.example.notesweb;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SessionInterceptor sessionInterceptor;
    private final LoginRequiredInterceptor loginRequiredInterceptor;

    public WebConfig(SessionInterceptor sessionInterceptor, LoginRequiredInterceptor loginRequiredInterceptor) {
        this.sessionInterceptor = sessionInterceptor;
        this.loginRequiredInterceptor = loginRequiredInterceptor;
    }

    // Kolejność ma znaczenie: sesja musi być zdekodowana przed sprawdzeniem logowania
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(sessionInterceptor)
                .addPathPatterns("/**")
                .excludePathPatterns("/css/**", "/error");
        registry.addInterceptor(loginRequiredInterceptor)
                .addPathPatterns("/notes", "/notes/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new RequestContextArgumentResolver());
    }
}
