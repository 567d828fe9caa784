package com.cgi.privsense.requestscanner.model;

import com.cgi.privsense.requestscanner.model.enums.PIIType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated PII values found in one record, one list per PII type.
 * Every type is always present; an empty list means nothing was found.
 */
@Value
@Builder(toBuilder = true)
public class PIIMapping {
    @Builder.Default
    List<String> primaryNationalIds = List.of();

    @Builder.Default
    List<String> secondaryNationalIds = List.of();

    @Builder.Default
    List<String> emails = List.of();

    @Builder.Default
    List<String> phoneNumbers = List.of();

    @Builder.Default
    List<String> addresses = List.of();

    @Builder.Default
    List<String> personNames = List.of();

    public static PIIMapping empty() {
        return PIIMapping.builder().build();
    }

    /**
     * Gets the values detected for a PII type.
     *
     * @param type PII type
     * @return Values, never null
     */
    public List<String> get(PIIType type) {
        return switch (type) {
            case PRIMARY_NATIONAL_ID -> primaryNationalIds;
            case SECONDARY_NATIONAL_ID -> secondaryNationalIds;
            case EMAIL -> emails;
            case PHONE_NUMBER -> phoneNumbers;
            case ADDRESS -> addresses;
            case PERSON_NAME -> personNames;
        };
    }

    /**
     * Returns a copy of this mapping with the values of one type replaced.
     *
     * @param type PII type to replace
     * @param values New values
     * @return Updated mapping
     */
    public PIIMapping with(PIIType type, Collection<String> values) {
        List<String> copy = List.copyOf(values);
        PIIMappingBuilder builder = toBuilder();
        switch (type) {
            case PRIMARY_NATIONAL_ID -> builder.primaryNationalIds(copy);
            case SECONDARY_NATIONAL_ID -> builder.secondaryNationalIds(copy);
            case EMAIL -> builder.emails(copy);
            case PHONE_NUMBER -> builder.phoneNumbers(copy);
            case ADDRESS -> builder.addresses(copy);
            case PERSON_NAME -> builder.personNames(copy);
        }
        return builder.build();
    }

    /**
     * Restricts the mapping to the types that have at least one value.
     *
     * @return Non-empty entries in PII type declaration order
     */
    public Map<PIIType, List<String>> nonEmptyEntries() {
        Map<PIIType, List<String>> entries = new EnumMap<>(PIIType.class);
        for (PIIType type : PIIType.values()) {
            List<String> values = get(type);
            if (!values.isEmpty()) {
                entries.put(type, values);
            }
        }
        return entries;
    }

    /**
     * Checks whether any of the given types has at least one value.
     *
     * @param types PII types to check
     * @return true if one of them is non-empty
     */
    public boolean hasAny(Collection<PIIType> types) {
        return types.stream().anyMatch(type -> !get(type).isEmpty());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !hasAny(List.of(PIIType.values()));
    }
}
