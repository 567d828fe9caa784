package com.cgi.privsense.requestscanner.extractor;

import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brazilian phone numbers: optional +55, optional DDD (with or without
 * parentheses), optional mobile 9, then 9999-9999. The country prefix
 * is matched but left out of the candidate, which holds the national number.
 */
@Component
public class PhoneNumberExtractor extends AbstractRegexExtractor {
    private static final String NUMBER_GROUP = "number";

    // A match may not start inside a number, after "(" or after "+"
    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "(?<![\\w(+])(?:\\+55\\s?)?(?<" + NUMBER_GROUP + ">(?:\\(?\\d{2}\\)?\\s?)?9?\\d{4}-?\\d{4})\\b");

    @Override
    public PIIType getType() {
        return PIIType.PHONE_NUMBER;
    }

    @Override
    protected Pattern getPattern() {
        return PHONE_PATTERN;
    }

    @Override
    protected Candidate toCandidate(Matcher matcher) {
        return new Candidate(getType(), matcher.group(NUMBER_GROUP), matcher.start(NUMBER_GROUP));
    }
}
