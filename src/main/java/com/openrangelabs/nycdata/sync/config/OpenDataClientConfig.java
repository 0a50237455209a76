package com.openrangelabs.nycdata.sync.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient used to talk to the NYC Open Data (Socrata) API
 */
@Configuration
public class OpenDataClientConfig {

    @Bean
    @Qualifier("openDataWebClient")
    WebClient openDataWebClient(NycDataProperties properties) {
        NycDataProperties.Source source = properties.getSource();
        int maxBytes = Math.max(2, source.getMaxInMemorySizeMb()) * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
                .build();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(Duration.ofSeconds(source.getTimeoutSeconds()));

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(source.getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies);

        if (StringUtils.hasText(source.getAppToken())) {
            builder.defaultHeader("X-App-Token", source.getAppToken());
        }
        return builder.build();
    }
}
