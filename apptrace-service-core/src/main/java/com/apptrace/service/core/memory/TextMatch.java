package com.apptrace.service.core.memory;

import com.apptrace.telemetry.model.AttributeValue;
import java.util.Locale;
import java.util.Map;

/** Case-insensitive substring matching with the same semantics as SQL {@code ILIKE '%term%'}. */
final class TextMatch {

    private TextMatch() {}

    static String normalize(String term) {
        return term == null ? "" : term.toLowerCase(Locale.ROOT);
    }

    static boolean contains(String text, String normalizedTerm) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(normalizedTerm);
    }

    /** Keys and values are matched one at a time, never against a serialized form of the map. */
    static boolean containsInAttributes(Map<String, AttributeValue> attributes, String normalizedTerm) {
        for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
            if (contains(entry.getKey(), normalizedTerm) || contains(entry.getValue().asText(), normalizedTerm)) {
                return true;
            }
        }
        return false;
    }
}
