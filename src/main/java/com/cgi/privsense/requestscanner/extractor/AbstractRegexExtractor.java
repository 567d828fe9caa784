/*
 * AbstractRegexExtractor.java - Base class for regex-driven PII extractors
 */
package com.cgi.privsense.requestscanner.extractor;

import com.cgi.privsense.requestscanner.api.PatternExtractor;
import com.cgi.privsense.requestscanner.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base extractor for PII candidates.
 * Provides the match loop shared by all pattern extractors.
 */
public abstract class AbstractRegexExtractor implements PatternExtractor {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * Collects every non-overlapping match of a pattern.
     *
     * @param pattern Compiled pattern
     * @param text Normalized text
     * @return Candidates in match order
     */
    protected List<Candidate> findAll(Pattern pattern, String text) {
        List<Candidate> candidates = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            candidates.add(toCandidate(matcher));
        }
        return candidates;
    }

    /**
     * Builds the candidate of the current match. The whole match is kept by default.
     *
     * @param matcher Matcher positioned on a match
     * @return Candidate for the match
     */
    protected Candidate toCandidate(Matcher matcher) {
        return new Candidate(getType(), matcher.group(), matcher.start());
    }

    @Override
    public List<Candidate> extract(String text) {
        List<Candidate> candidates = findAll(getPattern(), text);
        log.debug("{} candidates found for {}", candidates.size(), getType());
        return candidates;
    }

    /**
     * Pattern used by {@link #extract(String)}.
     *
     * @return Compiled pattern
     */
    protected abstract Pattern getPattern();
}
