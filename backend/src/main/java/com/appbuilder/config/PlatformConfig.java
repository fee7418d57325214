package com.appbuilder.config;

import com.appbuilder.platform.Platform;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlatformConfig {

    @Bean
    public Platform platform() {
        return Platform.current();
    }
}
