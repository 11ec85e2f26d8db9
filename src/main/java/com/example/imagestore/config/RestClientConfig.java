package com.example.imagestore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class RestClientConfig {

    @Bean("imageFetchRestClient")
    public RestClient imageFetchRestClient(ImageProperties properties) {
        HttpClient hc = HttpClient.newBuilder()
            .connectTimeout(properties.getFetchConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(properties.getFetchReadTimeout());

        return RestClient.builder()
            .requestFactory(rf)
            .defaultHeader(HttpHeaders.USER_AGENT, "image-store/1.0")
            .build();
    }
}
