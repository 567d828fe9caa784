package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.api.CandidateValidator;
import com.cgi.privsense.requestscanner.config.PIIVocabulary;
import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

/**
 * RG check: 7 to 9 digits, and an identity-document keyword
 * ("rg", "registro geral", "identidade") in the 15 characters before the match.
 */
@Component
public class SecondaryNationalIdValidator implements CandidateValidator {
    static final int CONTEXT_WINDOW_SIZE = 15;
    private static final int MIN_DIGITS = 7;
    private static final int MAX_DIGITS = 9;

    private final PIIVocabulary vocabulary;

    public SecondaryNationalIdValidator(PIIVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public PIIType getType() {
        return PIIType.SECONDARY_NATIONAL_ID;
    }

    @Override
    public boolean isValid(Candidate candidate, ScanContext context) {
        int digits = DigitCounts.digitsOf(candidate.getValue()).length();
        if (digits < MIN_DIGITS || digits > MAX_DIGITS) {
            return false;
        }

        String window = context.precedingWindow(candidate.getStart(), CONTEXT_WINDOW_SIZE);
        return vocabulary.mentionsIdentityDocument(window);
    }
}
