package com.cgi.privsense.requestscanner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VocabularyConfig {
    private static final Logger log = LoggerFactory.getLogger(VocabularyConfig.class);

    @Bean
    public PIIVocabulary piiVocabulary() {
        PIIVocabulary vocabulary = PIIVocabulary.defaults();
        log.info("PII vocabulary loaded with {} formal address phrases", vocabulary.getFormalAddressPhrases().size());
        return vocabulary;
    }
}
