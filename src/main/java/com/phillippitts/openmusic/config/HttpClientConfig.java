package com.phillippitts.openmusic.config;

import com.phillippitts.openmusic.config.properties.SourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client shared by the public API, mirror and feed adapters.
 *
 * <p>Transport timeouts sit slightly above typical backend deadlines; the resolver enforces the
 * real per-backend deadline on top of them.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient sourceRestClient(RestClient.Builder builder, SourceProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) props.getHttp().getConnectTimeout().toMillis());
        factory.setReadTimeout((int) props.getHttp().getReadTimeout().toMillis());

        return builder
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getHttp().getUserAgent())
                .build();
    }
}
