package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrimaryNationalIdValidatorTest {

    private final PrimaryNationalIdValidator validator = new PrimaryNationalIdValidator();

    private boolean validate(String value) {
        return validator.isValid(new Candidate(PIIType.PRIMARY_NATIONAL_ID, value, 0), new ScanContext(value));
    }

    @Test
    void acceptsElevenDigits() {
        assertTrue(validate("123.456.789-09"));
        assertTrue(validate("12345678909"));
    }

    @Test
    void rejectsTenDigits() {
        assertFalse(validate("123.456.789-0"));
    }
}
