package com.yerin.bookpipe.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BookpipeProperties.class)
class PropertiesConfig {
}
