package io.budgetmart.ecommerce.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class WebhookClientConfig {

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, WebhookProperties webhookProperties) {
        return builder
                .setConnectTimeout(webhookProperties.timeout())
                .setReadTimeout(webhookProperties.timeout())
                .build();
    }
}
