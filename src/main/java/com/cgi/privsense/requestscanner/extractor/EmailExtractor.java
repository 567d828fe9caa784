package com.cgi.privsense.requestscanner.extractor;

import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class EmailExtractor extends AbstractRegexExtractor {
    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    @Override
    public PIIType getType() {
        return PIIType.EMAIL;
    }

    @Override
    protected Pattern getPattern() {
        return EMAIL_PATTERN;
    }
}
