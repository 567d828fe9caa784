package com.cgi.privsense.requestscanner.extractor;

import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * RG numbers: 99.999.999-X, with every separator optional.
 * The pattern is generic; context is checked by the validator.
 */
@Component
public class SecondaryNationalIdExtractor extends AbstractRegexExtractor {
    private static final Pattern RG_PATTERN = Pattern.compile("\\b\\d{1,2}\\.?\\d{3}\\.?\\d{3}-?[0-9Xx]\\b");

    @Override
    public PIIType getType() {
        return PIIType.SECONDARY_NATIONAL_ID;
    }

    @Override
    protected Pattern getPattern() {
        return RG_PATTERN;
    }
}
