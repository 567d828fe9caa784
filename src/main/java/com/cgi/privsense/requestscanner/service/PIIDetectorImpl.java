/*
 * PIIDetectorImpl.java - Detection pipeline for request records
 */
package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.api.CandidateValidator;
import com.cgi.privsense.requestscanner.api.PIIDetector;
import com.cgi.privsense.requestscanner.api.PatternExtractor;
import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.PIIMapping;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import com.cgi.privsense.requestscanner.name.PersonNameExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pipeline: normalize, extract and validate each pattern type, resolve
 * conflicts between types, then add the person names.
 */
@Service
public class PIIDetectorImpl implements PIIDetector {
    private static final Logger log = LoggerFactory.getLogger(PIIDetectorImpl.class);

    private final TextNormalizer normalizer;
    private final Map<PIIType, PatternExtractor> extractors = new EnumMap<>(PIIType.class);
    private final Map<PIIType, CandidateValidator> validators = new EnumMap<>(PIIType.class);
    private final ConflictResolver conflictResolver;
    private final PersonNameExtractor nameExtractor;

    public PIIDetectorImpl(TextNormalizer normalizer,
                           List<PatternExtractor> extractors,
                           List<CandidateValidator> validators,
                           ConflictResolver conflictResolver,
                           PersonNameExtractor nameExtractor) {
        this.normalizer = normalizer;
        this.conflictResolver = conflictResolver;
        this.nameExtractor = nameExtractor;

        for (PatternExtractor extractor : extractors) {
            if (this.extractors.put(extractor.getType(), extractor) != null) {
                throw new IllegalStateException("Duplicate extractor for " + extractor.getType());
            }
        }
        for (CandidateValidator validator : validators) {
            if (this.validators.put(validator.getType(), validator) != null) {
                throw new IllegalStateException("Duplicate validator for " + validator.getType());
            }
        }
        for (PIIType type : this.extractors.keySet()) {
            if (!this.validators.containsKey(type)) {
                throw new IllegalStateException("No validator registered for " + type);
            }
        }

        log.info("PII detection pipeline initialized with extractors for {}", this.extractors.keySet());
    }

    @Override
    public PIIMapping detectPII(String text) {
        String normalized = normalizer.normalize(text);
        ScanContext context = new ScanContext(normalized);

        PIIMapping mapping = PIIMapping.empty();
        for (Map.Entry<PIIType, PatternExtractor> entry : extractors.entrySet()) {
            PIIType type = entry.getKey();
            mapping = mapping.with(type, extractValidated(entry.getValue(), validators.get(type), context));
        }

        mapping = conflictResolver.resolve(mapping);
        mapping = mapping.with(PIIType.PERSON_NAME, nameExtractor.extractNames(normalized));

        log.debug("Detection completed: {}", describe(mapping));
        return mapping;
    }

    /**
     * Runs an extractor and keeps the distinct values accepted by the validator.
     * A value is kept if any of its occurrences is accepted.
     */
    private Set<String> extractValidated(PatternExtractor extractor, CandidateValidator validator,
                                         ScanContext context) {
        Set<String> accepted = new LinkedHashSet<>();
        for (Candidate candidate : extractor.extract(context.getText())) {
            if (!accepted.contains(candidate.getValue()) && validator.isValid(candidate, context)) {
                accepted.add(candidate.getValue());
            }
        }
        return accepted;
    }

    private static String describe(PIIMapping mapping) {
        Map<PIIType, Integer> counts = new EnumMap<>(PIIType.class);
        mapping.nonEmptyEntries().forEach((type, values) -> counts.put(type, values.size()));
        return counts.isEmpty() ? "no PII" : counts.toString();
    }
}
