package com.cgi.privsense.requestscanner.name;

import com.cgi.privsense.requestscanner.config.PIIVocabulary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Structural check of a cleaned name: proper-noun shape, 2 to 7 tokens,
 * connectors allowed inside the name.
 */
@Component
public class PersonNameValidator {
    static final int MIN_TOKENS = 2;
    static final int MAX_TOKENS = 7;

    private final PIIVocabulary vocabulary;

    public PersonNameValidator(PIIVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Checks whether the tokens form a plausible person name.
     *
     * @param tokens Name tokens after title and suffix removal
     * @return true if the name is accepted
     */
    public boolean isValid(List<String> tokens) {
        if (tokens.size() < MIN_TOKENS || tokens.size() > MAX_TOKENS) {
            return false;
        }

        // "Nossa Senhora de ..." and similar recognizer mistakes
        if (vocabulary.isLeadingPronoun(tokens.get(0))) {
            return false;
        }

        if (tokens.get(0).equals(tokens.get(tokens.size() - 1))) {
            return false;
        }

        for (String token : tokens) {
            if (vocabulary.isNameConnector(token)) {
                continue;
            }
            if (vocabulary.isForbiddenWord(token)) {
                return false;
            }
            if (!Character.isUpperCase(token.codePointAt(0))) {
                return false;
            }
        }

        return true;
    }
}
