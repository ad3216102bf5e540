package com.venuebooking.booking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One RestTemplate per outbound adapter so each dependency gets its own timeouts.
 * The calendar read timeout matches the availability deadline, since a slower
 * answer is discarded anyway.
 */
@Configuration
public class RestClientConfiguration {

    public static final String CALENDAR_PROVIDER = "calendarProviderRestTemplate";
    public static final String PAYMENT_GATEWAY = "paymentGatewayRestTemplate";
    public static final String MAIL = "mailRestTemplate";

    @Value("${http.client.connect-timeout-ms:2000}")
    private int connectTimeout;

    @Bean(CALENDAR_PROVIDER)
    public RestTemplate calendarProviderRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper,
                                                     @Value("${booking.calendar.timeout-ms:3000}") int readTimeout) {
        return build(builder, objectMapper, readTimeout);
    }

    @Bean(PAYMENT_GATEWAY)
    public RestTemplate paymentGatewayRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper,
                                                   @Value("${payment-gateway.read-timeout-ms:10000}") int readTimeout) {
        return build(builder, objectMapper, readTimeout);
    }

    @Bean(MAIL)
    public RestTemplate mailRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper,
                                         @Value("${mail.read-timeout-ms:5000}") int readTimeout) {
        return build(builder, objectMapper, readTimeout);
    }

    private RestTemplate build(RestTemplateBuilder builder, ObjectMapper objectMapper, int readTimeout) {
        MappingJackson2HttpMessageConverter converter = new MappingJackson2HttpMessageConverter();
        converter.setObjectMapper(objectMapper);

        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeout))
                .setReadTimeout(Duration.ofMillis(readTimeout))
                .additionalMessageConverters(converter)
                .build();
    }
}
