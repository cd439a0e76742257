package com.mixtape.playlist.config;

import com.mixtape.playlist.infrastructure.api.controller.CallerIdentityInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new CallerIdentityInterceptor())
                .addPathPatterns("/playlists", "/playlists/**");
    }
}
