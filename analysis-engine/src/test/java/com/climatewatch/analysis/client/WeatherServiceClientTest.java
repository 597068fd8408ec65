package com.climatewatch.analysis.client;

import com.climatewatch.common.exception.WeatherFetchException;
import com.climatewatch.common.model.LiveTemperature;
import com.climatewatch.common.model.WeatherFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WeatherServiceClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WeatherServiceClient client(HttpStatus status, String body) {
        return client(request -> {
            ClientResponse.Builder response = ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
            return Mono.just((body == null ? response : response.body(body)).build());
        });
    }

    private WeatherServiceClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://weather-service.test")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return exchange.exchange(request);
            })
            .build();
        return new WeatherServiceClient(webClient, 5);
    }

    private static void assertFailure(Throwable e, WeatherFailure expected) {
        assertInstanceOf(WeatherFetchException.class, e);
        assertEquals(expected, ((WeatherFetchException) e).getFailure());
    }

    @Test
    @DisplayName("200 → live temperature, API key forwarded as header")
    void success() {
        String body = "{\"city\":\"Berlin\",\"temperature\":24.6,\"month\":7,\"observedAt\":\"2024-07-15T12:00:00Z\"}";

        StepVerifier.create(client(HttpStatus.OK, body).fetch("Berlin", "secret"))
            .assertNext(t -> assertEquals(
                new LiveTemperature("Berlin", 24.6, 7, Instant.parse("2024-07-15T12:00:00Z")), t))
            .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertTrue(request.url().getPath().endsWith("/api/v1/weather/current/Berlin"), request.url().toString());
        assertEquals("secret", request.headers().getFirst(WeatherServiceClient.API_KEY_HEADER));
    }

    @Test
    @DisplayName("error body kind is carried over")
    void errorKindFromBody() {
        StepVerifier.create(client(HttpStatus.UNAUTHORIZED,
                "{\"kind\":\"INVALID_CREDENTIAL\",\"message\":\"bad key\"}").fetch("Berlin", "bad"))
            .expectErrorSatisfies(e -> {
                assertFailure(e, WeatherFailure.INVALID_CREDENTIAL);
                assertTrue(e.getMessage().contains("bad key"), e.getMessage());
            })
            .verify();
    }

    @Test
    @DisplayName("404 without body → CITY_LOOKUP_FAILURE from status")
    void statusFallback() {
        StepVerifier.create(client(HttpStatus.NOT_FOUND, null).fetch("Atlantis", "k"))
            .expectErrorSatisfies(e -> assertFailure(e, WeatherFailure.CITY_LOOKUP_FAILURE))
            .verify();
    }

    @Test
    @DisplayName("502 from weather-service → TRANSPORT_FAILURE")
    void badGateway() {
        StepVerifier.create(client(HttpStatus.BAD_GATEWAY,
                "{\"kind\":\"TRANSPORT_FAILURE\",\"message\":\"read timed out\"}").fetch("Berlin", "k"))
            .expectErrorSatisfies(e -> assertFailure(e, WeatherFailure.TRANSPORT_FAILURE))
            .verify();
    }

    @Test
    @DisplayName("weather-service unreachable → TRANSPORT_FAILURE")
    void unreachable() {
        WeatherServiceClient refusing = client(request -> Mono.error(new WebClientRequestException(
            new ConnectException("Connection refused"), HttpMethod.GET, request.url(), new HttpHeaders())));

        StepVerifier.create(refusing.fetch("Berlin", "k"))
            .expectErrorSatisfies(e -> assertFailure(e, WeatherFailure.TRANSPORT_FAILURE))
            .verify();
    }
}
