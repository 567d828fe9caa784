package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.api.CandidateValidator;
import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

/**
 * Brazilian phone check: 10 or 11 digits starting with a DDD in 11..99.
 */
@Component
public class PhoneNumberValidator implements CandidateValidator {
    private static final int MIN_AREA_CODE = 11;
    private static final int MAX_AREA_CODE = 99;

    @Override
    public PIIType getType() {
        return PIIType.PHONE_NUMBER;
    }

    @Override
    public boolean isValid(Candidate candidate, ScanContext context) {
        String digits = DigitCounts.digitsOf(candidate.getValue());
        if (digits.length() != 10 && digits.length() != 11) {
            return false;
        }

        int areaCode = Integer.parseInt(digits.substring(0, 2));
        return areaCode >= MIN_AREA_CODE && areaCode <= MAX_AREA_CODE;
    }
}
