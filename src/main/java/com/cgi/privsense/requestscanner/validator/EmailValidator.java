package com.cgi.privsense.requestscanner.validator;

import com.cgi.privsense.requestscanner.api.CandidateValidator;
import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

/**
 * Emails are accepted as extracted; the pattern already implies a valid shape.
 */
@Component
public class EmailValidator implements CandidateValidator {

    @Override
    public PIIType getType() {
        return PIIType.EMAIL;
    }

    @Override
    public boolean isValid(Candidate candidate, ScanContext context) {
        return true;
    }
}
