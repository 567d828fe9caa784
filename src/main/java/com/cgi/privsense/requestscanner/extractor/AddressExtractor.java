package com.cgi.privsense.requestscanner.extractor;

import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Address fragments: street-type keyword followed by free text, or a
 * block/lot keyword followed by an identifier. Both are pooled.
 */
@Component
public class AddressExtractor extends AbstractRegexExtractor {
    private static final int MAX_STREET_TEXT_LENGTH = 120;

    private static final Pattern STREET_PATTERN = Pattern.compile(
            "\\b(?:Rua|R\\.|Avenida|Av\\.?|Travessa|Tv\\.?|Alameda|Estrada|Rodovia)\\s+[A-Za-zÀ-ÿ0-9\\s]{3,"
                    + MAX_STREET_TEXT_LENGTH + "}",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern BLOCK_LOT_PATTERN = Pattern.compile(
            "\\b(?:Qd\\.?|Quadra|Lt\\.?|Lote|Bloco|BLC|Conjunto|CJ)\\s*[A-Za-z0-9\\-]+\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public PIIType getType() {
        return PIIType.ADDRESS;
    }

    @Override
    public List<Candidate> extract(String text) {
        List<Candidate> candidates = new ArrayList<>();
        for (Candidate street : findAll(getPattern(), text)) {
            // the free-text run also swallows whitespace before the next punctuation
            candidates.add(new Candidate(street.getPiiType(), street.getValue().stripTrailing(), street.getStart()));
        }
        candidates.addAll(findAll(BLOCK_LOT_PATTERN, text));
        log.debug("{} candidates found for {}", candidates.size(), getType());
        return candidates;
    }

    /**
     * Street sub-pattern; block and lot matches are pooled in {@link #extract(String)}.
     */
    @Override
    protected Pattern getPattern() {
        return STREET_PATTERN;
    }
}
