package com.flare.mentionsprocessor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * RestTemplate dedicated to the sentiment classification provider.
 */
@Configuration
public class SentimentApiConfig {

    @Bean
    public RestTemplate sentimentRestTemplate(MentionsProcessorProperties properties) {
        MentionsProcessorProperties.Sentiment sentiment = properties.getSentiment();

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(sentiment.getConnectTimeoutMs());
        factory.setReadTimeout(sentiment.getReadTimeoutMs());

        RestTemplate restTemplate = new RestTemplate(factory);

        if (sentiment.isConfigured()) {
            ClientHttpRequestInterceptor bearerInterceptor = (request, body, execution) -> {
                request.getHeaders().set(HttpHeaders.AUTHORIZATION, "Bearer " + sentiment.getApiKey());
                return execution.execute(request, body);
            };
            restTemplate.setInterceptors(List.of(bearerInterceptor));
        }

        return restTemplate;
    }
}
