package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.api.CandidateValidator;
import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

/**
 * CPF format check: exactly 11 digits. Check digits are not verified.
 */
@Component
public class PrimaryNationalIdValidator implements CandidateValidator {
    private static final int CPF_DIGITS = 11;

    @Override
    public PIIType getType() {
        return PIIType.PRIMARY_NATIONAL_ID;
    }

    @Override
    public boolean isValid(Candidate candidate, ScanContext context) {
        return DigitCounts.digitsOf(candidate.getValue()).length() == CPF_DIGITS;
    }
}
