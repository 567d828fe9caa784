package com.cgi.privsense.requestscanner.ner;

import com.cgi.privsense.requestscanner.api.EntityRecognizer;
import com.cgi.privsense.requestscanner.exception.EntityRecognitionException;
import com.cgi.privsense.requestscanner.exception.RecognizerInitializationException;
import com.cgi.privsense.requestscanner.model.EntitySpan;
import com.cgi.privsense.requestscanner.model.enums.EntityCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the external NER (Named Entity Recognition) service.
 * Uses RestTemplate to communicate with the NER HTTP service.
 */
public class HttpEntityRecognizer implements EntityRecognizer {
    private static final Logger log = LoggerFactory.getLogger(HttpEntityRecognizer.class);

    private final RestTemplate restTemplate;
    private final String nerServiceUrl;

    public HttpEntityRecognizer(RestTemplate restTemplate, String nerServiceUrl) {
        this.restTemplate = restTemplate;
        this.nerServiceUrl = nerServiceUrl;
    }

    /**
     * Probes the service health endpoint.
     *
     * @param healthUrl Health endpoint URL
     * @throws RecognizerInitializationException if the service does not answer with a 2xx status
     */
    public void verifyAvailability(String healthUrl) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(healthUrl, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new RecognizerInitializationException(
                        "NER service health check failed with status " + response.getStatusCode());
            }
            log.info("NER service available at: {}", nerServiceUrl);
        } catch (RestClientException e) {
            throw new RecognizerInitializationException("NER service not available at " + healthUrl, e);
        }
    }

    @Override
    public List<EntitySpan> recognize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        NerServiceResponse body;
        try {
            body = restTemplate.postForObject(nerServiceUrl, Map.of("text", text), NerServiceResponse.class);
        } catch (RestClientException e) {
            throw new EntityRecognitionException("Exception when calling NER service: " + e.getMessage(), e);
        }

        if (body == null || body.getEntities() == null) {
            return Collections.emptyList();
        }

        List<EntitySpan> spans = new ArrayList<>(body.getEntities().size());
        for (NerServiceResponse.Entity entity : body.getEntities()) {
            spans.add(EntitySpan.builder()
                    .text(entity.getText())
                    .category(mapLabel(entity.getLabel()))
                    .start(entity.getStart())
                    .end(entity.getEnd())
                    .build());
        }
        log.debug("NER service returned {} entities", spans.size());
        return spans;
    }

    /**
     * Maps a NER label to an entity category.
     *
     * @param label NER label, possibly with a B-/I- prefix
     * @return Corresponding category
     */
    static EntityCategory mapLabel(String label) {
        if (label == null) {
            return EntityCategory.OTHER;
        }

        // Extract the main type (after the I-, B-, etc. prefix)
        String type = label;
        if (label.contains("-")) {
            String[] parts = label.split("-", 2);
            if (parts.length > 1) {
                type = parts[1];
            }
        }

        return switch (type.toUpperCase(Locale.ROOT)) {
            case "PER", "PERSON" -> EntityCategory.PERSON;
            case "LOC", "GPE" -> EntityCategory.LOCATION;
            case "ORG" -> EntityCategory.ORGANIZATION;
            case "MISC" -> EntityCategory.MISCELLANEOUS;
            default -> EntityCategory.OTHER;
        };
    }
}
