package com.entity.linking.scoring;

import com.entity.linking.core.model.EntityCategory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Terms that identify a knowledge base type as belonging to an entity category.
 * Matching is a case-insensitive substring test against the candidate's raw type.
 */
public final class TypeVocabulary {

    private static final Map<EntityCategory, List<String>> MATCH_TERMS = Map.of(
            EntityCategory.COMPANY, List.of("company", "corporation", "organisation", "organization"),
            EntityCategory.PERSON, List.of("person", "human", "agent"),
            EntityCategory.PLACE, List.of("place", "location", "city", "country", "region"),
            EntityCategory.PRODUCT, List.of("product", "good", "device", "software")
    );

    // Adjacent categories earn a partial bonus: a brand or product is weak evidence for a company
    private static final Map<EntityCategory, List<String>> PARTIAL_TERMS = Map.of(
            EntityCategory.COMPANY, List.of("product", "brand"),
            EntityCategory.PRODUCT, List.of("brand", "company")
    );

    /**
     * Description vocabulary that supports a company reading.
     */
    public static final List<String> COMPANY_DOMAIN_TERMS = List.of(
            "company", "corporation", "business", "technology", "software", "hardware", "employees");

    private TypeVocabulary() {
    }

    public static List<String> matchTerms(EntityCategory category) {
        return MATCH_TERMS.getOrDefault(category, List.of());
    }

    public static List<String> partialTerms(EntityCategory category) {
        return PARTIAL_TERMS.getOrDefault(category, List.of());
    }

    public static boolean matches(EntityCategory category, String rawType) {
        return containsAny(rawType, matchTerms(category));
    }

    public static boolean partiallyMatches(EntityCategory category, String rawType) {
        return containsAny(rawType, partialTerms(category));
    }

    static boolean containsAny(String text, List<String> terms) {
        if (text == null || text.isEmpty() || terms.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
