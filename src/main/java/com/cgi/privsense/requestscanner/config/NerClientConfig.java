package com.cgi.privsense.requestscanner.config;

import com.cgi.privsense.requestscanner.ner.HttpEntityRecognizer;
import com.cgi.privsense.requestscanner.ner.LazyEntityRecognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Wiring of the NER service client.
 */
@Configuration
public class NerClientConfig {
    private static final Logger log = LoggerFactory.getLogger(NerClientConfig.class);

    @Bean
    public LazyEntityRecognizer entityRecognizer(
            @Value("${requestscanner.ner.service.url}") String nerServiceUrl,
            @Value("${requestscanner.ner.health.url}") String healthUrl,
            @Value("${requestscanner.ner.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${requestscanner.ner.read-timeout-ms:30000}") int readTimeoutMs) {

        log.info("NER Service Client configured with URL: {}", nerServiceUrl);
        return new LazyEntityRecognizer(() -> {
            HttpEntityRecognizer recognizer = new HttpEntityRecognizer(
                    createRestTemplate(connectTimeoutMs, readTimeoutMs), nerServiceUrl);
            recognizer.verifyAvailability(healthUrl);
            return recognizer;
        });
    }

    /**
     * Initializes the recognizer during startup so that an unavailable
     * service aborts the application.
     */
    @Bean
    @ConditionalOnProperty(name = "requestscanner.ner.initialize-on-startup", havingValue = "true")
    public ApplicationRunner entityRecognizerInitializer(LazyEntityRecognizer entityRecognizer) {
        return args -> entityRecognizer.initialize();
    }

    private RestTemplate createRestTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }
}
