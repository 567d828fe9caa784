package com.cgi.privsense.requestscanner.ner;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response body of the NER service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NerServiceResponse {
    private List<Entity> entities = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entity {
        private String text;
        private String label;
        private int start;
        private int end;
    }
}
