package org.linescan.config;

import org.linescan.YamlTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TransformerProperties.class)
public class TransformerConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformerConfiguration.class);

    @Bean
    public YamlTransformer yamlTransformer(TransformerProperties properties) {
        LOGGER.info("YAML transformer handles extensions {}", properties.getExtensions());
        return new YamlTransformer(properties);
    }
}
