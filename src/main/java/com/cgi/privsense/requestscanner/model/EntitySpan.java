package com.cgi.privsense.requestscanner.model;

import com.cgi.privsense.requestscanner.model.enums.EntityCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity span returned by the named-entity recognizer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntitySpan {
    private String text;
    private EntityCategory category;
    private int start;
    private int end;

    public boolean isPerson() {
        return category == EntityCategory.PERSON;
    }
}
