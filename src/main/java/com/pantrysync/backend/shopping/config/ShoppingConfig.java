package com.pantrysync.backend.shopping.config;

import com.pantrysync.backend.shopping.service.ShoppingFieldMapping;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ShoppingSchemaProperties.class)
public class ShoppingConfig {

    // 啟動時決定一次，之後每次 merge 都用同一份 mapping
    @Bean
    public ShoppingFieldMapping shoppingFieldMapping(ShoppingSchemaProperties props) {
        return ShoppingFieldMapping.of(props.getFields(), props.getDefaultStatus());
    }
}
