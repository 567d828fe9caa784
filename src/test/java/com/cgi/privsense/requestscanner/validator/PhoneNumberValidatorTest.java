package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhoneNumberValidatorTest {

    private final PhoneNumberValidator validator = new PhoneNumberValidator();

    private boolean validate(String value) {
        return validator.isValid(new Candidate(PIIType.PHONE_NUMBER, value, 0), new ScanContext(value));
    }

    @Test
    @DisplayName("Should accept mobile and landline numbers with a valid DDD")
    void acceptsValidNumbers() {
        assertTrue(validate("(61) 99876-5432"));
        assertTrue(validate("(99) 3333-4444"));
        assertTrue(validate("1133334444"));
    }

    @Test
    @DisplayName("Should reject area codes outside 11..99")
    void rejectsInvalidAreaCode() {
        assertFalse(validate("0533334444"));
        assertFalse(validate("(10) 3333-4444"));
    }

    @Test
    @DisplayName("Should reject numbers without an area code")
    void rejectsShortNumbers() {
        assertFalse(validate("3333-4444"));
        assertFalse(validate("99876-5432"));
    }
}
