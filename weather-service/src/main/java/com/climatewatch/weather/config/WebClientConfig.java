package com.climatewatch.weather.config;

import com.climatewatch.weather.client.OpenWeatherWebClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${openweather.base-url:https://api.openweathermap.org}")
    private String baseUrl;

    @Value("${openweather.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${openweather.response-timeout-seconds:10}")
    private int responseTimeoutSeconds;

    @Value("${openweather.max-retries:2}")
    private int maxRetries;

    @Value("${openweather.retry-backoff-ms:300}")
    private long retryBackoffMs;

    @Bean
    public WebClient openWeatherWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public OpenWeatherWebClient openWeatherClient(WebClient openWeatherWebClient) {
        return new OpenWeatherWebClient(openWeatherWebClient, maxRetries, Duration.ofMillis(retryBackoffMs));
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String uri = clientRequest.url().toString();
            String sanitized = uri.replaceAll("appid=[^&]+", "appid=***");
            org.slf4j.LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
