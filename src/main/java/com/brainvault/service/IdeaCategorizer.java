package com.brainvault.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic categorization of idea content.
 *
 * Project: keyword buckets checked in a fixed priority order, case-insensitive substring
 * match, first matching bucket wins.
 *
 * Theme: a small rule-based entity recognizer. An entity is a run of capitalized words that
 * does not open a sentence, or an upper-case acronym anywhere. Each entity is typed as
 * organization, product, place or person, and the first one in document order is the theme.
 * Without an entity the theme is "general".
 */
@Component
@Slf4j
public class IdeaCategorizer {

    public static final String DEFAULT_PROJECT = "General Ideas";
    public static final String DEFAULT_THEME = "general";

    /** Width of the theme column. */
    public static final int MAX_THEME_LENGTH = 100;

    private static final Map<String, List<String>> PROJECT_KEYWORDS = new LinkedHashMap<>();

    static {
        PROJECT_KEYWORDS.put("Startup Ideas", List.of(
                "startup", "business", "company", "founder", "revenue", "market", "investor", "venture", "monetize"));
        PROJECT_KEYWORDS.put("Blog Content", List.of(
                "blog", "article", "post", "write", "newsletter", "story", "content"));
        PROJECT_KEYWORDS.put("Product Features", List.of(
                "feature", "app", "product", "user", "interface", "ui", "dashboard", "integration"));
        PROJECT_KEYWORDS.put("Research Notes", List.of(
                "research", "study", "paper", "experiment", "hypothesis", "data", "analysis", "learn"));
    }

    private static final Pattern TOKEN = Pattern.compile("\\S+");
    private static final Pattern VERSION = Pattern.compile("v?\\d+(\\.\\d+)*");
    private static final Pattern ACRONYM = Pattern.compile("[A-Z][A-Z0-9]{1,5}s?");

    private static final Set<String> ORGANIZATION_SUFFIXES = Set.of(
            "Inc", "Corp", "Corporation", "Ltd", "LLC", "Labs", "Company", "Technologies",
            "Group", "University", "Institute", "Foundation");

    private static final Set<String> PLACE_PREPOSITIONS = Set.of(
            "in", "at", "from", "to", "near", "across", "around");

    private static final Set<String> PRODUCT_CUES = Set.of("using", "via");

    private static final Set<String> STOP_WORDS = Set.of(
            "I", "I'm", "I've", "I'd", "I'll", "We", "You", "He", "She", "They", "It", "My", "Our",
            "Your", "Their", "This", "That", "These", "Those", "The", "A", "An", "OK",
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday",
            "January", "February", "March", "April", "May", "June", "July", "August",
            "September", "October", "November", "December");

    public enum EntityType {
        ORGANIZATION, PRODUCT, PLACE, PERSON
    }

    /**
     * A recognized entity and its category.
     */
    @Value
    public static class Entity {
        String text;
        EntityType type;
    }

    /**
     * @return the project bucket label, "General Ideas" when nothing matches
     */
    public String categorizeProject(String content) {
        if (content == null) {
            return DEFAULT_PROJECT;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> bucket : PROJECT_KEYWORDS.entrySet()) {
            for (String keyword : bucket.getValue()) {
                if (lower.contains(keyword)) {
                    return bucket.getKey();
                }
            }
        }
        return DEFAULT_PROJECT;
    }

    /**
     * @return text of the first entity in document order, cut to {@link #MAX_THEME_LENGTH} at a word
     *         boundary; "general" when there is none
     */
    public String extractTheme(String content) {
        List<Entity> entities = extractEntities(content);
        if (entities.isEmpty()) {
            return DEFAULT_THEME;
        }
        Entity first = entities.get(0);
        log.debug("Theme entity: text='{}', type={}", first.getText(), first.getType());
        return fitThemeColumn(first.getText());
    }

    static String fitThemeColumn(String theme) {
        if (theme.length() <= MAX_THEME_LENGTH) {
            return theme;
        }
        int cut = theme.lastIndexOf(' ', MAX_THEME_LENGTH);
        return cut > 0 ? theme.substring(0, cut) : theme.substring(0, MAX_THEME_LENGTH);
    }

    /**
     * Recognize entities in document order.
     */
    public List<Entity> extractEntities(String content) {
        List<Entity> entities = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return entities;
        }

        List<String> raw = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(content);
        while (matcher.find()) {
            raw.add(matcher.group());
        }

        boolean sentenceStart = true;
        int i = 0;
        while (i < raw.size()) {
            String word = strip(raw.get(i));
            boolean startsSentence = sentenceStart;
            sentenceStart = endsSentence(raw.get(i));

            if (!isEntityWord(word, startsSentence)) {
                i++;
                continue;
            }

            // Extend the run while the following words are capitalized and no punctuation breaks it
            int end = i;
            while (!breaksRun(raw.get(end)) && end + 1 < raw.size()
                    && isCapitalized(strip(raw.get(end + 1))) && !STOP_WORDS.contains(strip(raw.get(end + 1)))) {
                end++;
            }

            List<String> words = new ArrayList<>();
            for (int k = i; k <= end; k++) {
                words.add(strip(raw.get(k)));
            }
            String previous = i > 0 ? strip(raw.get(i - 1)).toLowerCase(Locale.ROOT) : null;
            String next = end + 1 < raw.size() && !breaksRun(raw.get(end)) ? strip(raw.get(end + 1)) : null;

            entities.add(new Entity(String.join(" ", words), classify(words, previous, next)));

            sentenceStart = endsSentence(raw.get(end));
            i = end + 1;
        }
        return entities;
    }

    private EntityType classify(List<String> words, String previous, String next) {
        String last = words.get(words.size() - 1);
        if (ORGANIZATION_SUFFIXES.contains(last) || (words.size() == 1 && isAcronym(last))) {
            return EntityType.ORGANIZATION;
        }
        if ((next != null && VERSION.matcher(next).matches()) || (previous != null && PRODUCT_CUES.contains(previous))) {
            return EntityType.PRODUCT;
        }
        if (previous != null && PLACE_PREPOSITIONS.contains(previous)) {
            return EntityType.PLACE;
        }
        return EntityType.PERSON;
    }

    private boolean isEntityWord(String word, boolean startsSentence) {
        if (word.isEmpty() || STOP_WORDS.contains(word)) {
            return false;
        }
        if (isAcronym(word)) {
            return true;
        }
        return !startsSentence && isCapitalized(word);
    }

    private static boolean isAcronym(String word) {
        return ACRONYM.matcher(word).matches();
    }

    private static boolean isCapitalized(String word) {
        return !word.isEmpty() && Character.isUpperCase(word.charAt(0))
                && word.chars().anyMatch(Character::isLetter);
    }

    private static boolean endsSentence(String token) {
        char last = token.charAt(token.length() - 1);
        return last == '.' || last == '!' || last == '?';
    }

    private static boolean breaksRun(String token) {
        char last = token.charAt(token.length() - 1);
        return !Character.isLetterOrDigit(last);
    }

    private static String strip(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && !Character.isLetterOrDigit(token.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }
}
