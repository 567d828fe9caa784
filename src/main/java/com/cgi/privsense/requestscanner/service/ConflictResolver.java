package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.model.PIIMapping;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ensures a literal value is attributed to only one of the contested types.
 * Earlier types in {@link #PRIORITY} keep the value; email and person names are left alone.
 */
@Component
public class ConflictResolver {
    static final List<PIIType> PRIORITY = List.of(
            PIIType.PRIMARY_NATIONAL_ID,
            PIIType.SECONDARY_NATIONAL_ID,
            PIIType.PHONE_NUMBER,
            PIIType.ADDRESS);

    public PIIMapping resolve(PIIMapping mapping) {
        Set<String> claimed = new HashSet<>();
        PIIMapping resolved = mapping;

        for (PIIType type : PRIORITY) {
            List<String> kept = new ArrayList<>();
            for (String value : mapping.get(type)) {
                if (claimed.add(value)) {
                    kept.add(value);
                }
            }
            resolved = resolved.with(type, kept);
        }

        return resolved;
    }
}
