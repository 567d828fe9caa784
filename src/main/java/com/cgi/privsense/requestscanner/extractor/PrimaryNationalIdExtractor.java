package com.cgi.privsense.requestscanner.extractor;

import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * CPF numbers: 999.999.999-99, with every separator optional.
 */
@Component
public class PrimaryNationalIdExtractor extends AbstractRegexExtractor {
    private static final Pattern CPF_PATTERN = Pattern.compile("\\b\\d{3}\\.?\\d{3}\\.?\\d{3}-?\\d{1,2}\\b");

    @Override
    public PIIType getType() {
        return PIIType.PRIMARY_NATIONAL_ID;
    }

    @Override
    protected Pattern getPattern() {
        return CPF_PATTERN;
    }
}
