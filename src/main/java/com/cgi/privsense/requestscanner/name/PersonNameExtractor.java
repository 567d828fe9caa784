/*
 * PersonNameExtractor.java - Person names from recognizer spans and heuristics
 */
package com.cgi.privsense.requestscanner.name;

import com.cgi.privsense.requestscanner.api.EntityRecognizer;
import com.cgi.privsense.requestscanner.config.PIIVocabulary;
import com.cgi.privsense.requestscanner.model.EntitySpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts person names by combining the recognizer's PERSON spans with
 * cleanup and structural heuristics.
 */
@Component
public class PersonNameExtractor {
    private static final Logger log = LoggerFactory.getLogger(PersonNameExtractor.class);

    private final EntityRecognizer entityRecognizer;
    private final PIIVocabulary vocabulary;
    private final PersonNameValidator nameValidator;

    public PersonNameExtractor(EntityRecognizer entityRecognizer, PIIVocabulary vocabulary,
                               PersonNameValidator nameValidator) {
        this.entityRecognizer = entityRecognizer;
        this.vocabulary = vocabulary;
        this.nameValidator = nameValidator;
    }

    /**
     * Extracts the distinct person names of a text.
     *
     * @param text Normalized text
     * @return Cleaned names in first-seen order
     */
    public List<String> extractNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        int personSpans = 0;

        for (EntitySpan span : entityRecognizer.recognize(text)) {
            if (!span.isPerson() || span.getText() == null) {
                continue;
            }
            personSpans++;

            String raw = span.getText().strip();
            if (vocabulary.startsWithFormalAddress(raw)) {
                continue;
            }

            List<String> tokens = stripNoiseSuffixes(stripHonorificTitles(tokenize(raw)));
            if (nameValidator.isValid(tokens)) {
                names.add(String.join(" ", tokens));
            }
        }

        log.debug("{} of {} person spans accepted as names", names.size(), personSpans);
        return new ArrayList<>(names);
    }

    List<String> tokenize(String raw) {
        if (raw.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(raw.split("\\s+")));
    }

    /**
     * Removes honorific titles at both ends of the name.
     */
    List<String> stripHonorificTitles(List<String> tokens) {
        int start = 0;
        int end = tokens.size();
        while (start < end && vocabulary.isHonorificTitle(tokens.get(start))) {
            start++;
        }
        while (end > start && vocabulary.isHonorificTitle(tokens.get(end - 1))) {
            end--;
        }
        return new ArrayList<>(tokens.subList(start, end));
    }

    /**
     * Removes dangling labels such as "CPF:" from the end of the name.
     */
    List<String> stripNoiseSuffixes(List<String> tokens) {
        List<String> cleaned = new ArrayList<>(tokens);
        while (!cleaned.isEmpty() && vocabulary.isNoiseSuffix(cleaned.get(cleaned.size() - 1))) {
            cleaned.remove(cleaned.size() - 1);
        }
        return cleaned;
    }
}
