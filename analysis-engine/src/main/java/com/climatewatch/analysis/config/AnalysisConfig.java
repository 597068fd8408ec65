package com.climatewatch.analysis.config;

import com.climatewatch.common.analysis.ClimateAnalyzer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class AnalysisConfig {

    @Value("${services.weather.base-url}")
    private String weatherServiceUrl;

    @Value("${analysis.rolling-window:30}")
    private int rollingWindow;

    @Bean
    public WebClient weatherServiceWebClient(WebClient.Builder builder) {
        return builder.baseUrl(weatherServiceUrl).build();
    }

    @Bean
    public ClimateAnalyzer climateAnalyzer() {
        return new ClimateAnalyzer(rollingWindow);
    }

    @Bean
    public CsvMapper csvMapper() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        return mapper;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
