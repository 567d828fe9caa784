package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.model.PIIMapping;
import com.cgi.privsense.requestscanner.model.enums.ClassificationVerdict;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * A record is non-public as soon as one strong PII type has a value.
 */
@Component
public class PIIClassifier {
    private static final Logger log = LoggerFactory.getLogger(PIIClassifier.class);

    private final Set<PIIType> strongTypes;

    @Autowired
    public PIIClassifier(@Value("${requestscanner.classifier.strong-types:"
            + "PRIMARY_NATIONAL_ID,SECONDARY_NATIONAL_ID,EMAIL,PHONE_NUMBER,ADDRESS,PERSON_NAME}") String[] strongTypeNames) {
        this(Arrays.stream(strongTypeNames)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(name -> PIIType.valueOf(name.toUpperCase(Locale.ROOT)))
                .toList());
    }

    public PIIClassifier(Collection<PIIType> strongTypes) {
        this.strongTypes = strongTypes.isEmpty()
                ? EnumSet.noneOf(PIIType.class)
                : EnumSet.copyOf(strongTypes);
        log.info("PII classifier initialized with strong types: {}", this.strongTypes);
    }

    public ClassificationVerdict classify(PIIMapping mapping) {
        return mapping.hasAny(strongTypes) ? ClassificationVerdict.NON_PUBLIC : ClassificationVerdict.PUBLIC;
    }

    public Set<PIIType> getStrongTypes() {
        return EnumSet.copyOf(strongTypes);
    }
}
