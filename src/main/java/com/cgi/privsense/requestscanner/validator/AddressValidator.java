package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.api.CandidateValidator;
import com.cgi.privsense.requestscanner.config.PIIVocabulary;
import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

/**
 * An address needs a street/block keyword and a number.
 */
@Component
public class AddressValidator implements CandidateValidator {
    private final PIIVocabulary vocabulary;

    public AddressValidator(PIIVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public PIIType getType() {
        return PIIType.ADDRESS;
    }

    @Override
    public boolean isValid(Candidate candidate, ScanContext context) {
        String value = candidate.getValue();
        return vocabulary.mentionsAddressKeyword(value) && value.chars().anyMatch(Character::isDigit);
    }
}
