package com.cw.contentflow.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 로컬 아카이브 마크다운을 /local-archive/** 로 노출 (LocalArchiveBackend 가 돌려주는 URL)
 */
@Configuration
public class ArchiveResourceConfig implements WebMvcConfigurer {

    @Value("${contentflow.archive.local-dir:./data/archive}")
    private String localDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = "file:" + localDir.replace("\\", "/");
        if (!location.endsWith("/")) location += "/";
        registry.addResourceHandler("/local-archive/**")
                .addResourceLocations(location);
    }
}
