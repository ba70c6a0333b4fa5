package com.casesentinel.core.trend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts significant terms from case summaries.
 *
 * <p>
 * Text is lowercased, stripped of punctuation other than hyphens and
 * whitespace-collapsed. A word is significant when it has at least three
 * characters and is not a stop word. Terms are the significant words plus
 * every bigram of two adjacent significant words.
 * </p>
 *
 * @since 1.0.0
 */
public final class TermExtractor {

    static final int MIN_TERM_LENGTH = 3;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Set<String> STOP_WORDS = Set.of(
            // English
            "a", "an", "the", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "shall", "can", "need", "dare", "ought",
            "used", "this", "that", "these", "those", "am", "your", "yours", "yourself",
            "he", "she", "it", "we", "they", "them", "their", "his", "her", "its",
            "our", "me", "him", "my", "i", "you", "who", "whom", "which", "what",
            "where", "when", "why", "how", "all", "each", "every", "both", "few",
            "more", "most", "other", "some", "such", "no", "nor", "not", "only",
            "own", "same", "so", "than", "too", "very", "just", "also", "now",
            "here", "there", "then", "once", "if", "because", "until", "while",
            "about", "against", "between", "into", "through", "during", "before",
            "after", "above", "below", "up", "down", "out", "off", "over", "under",
            "again", "further", "being", "having", "doing", "any", "dont", "doesnt",
            "didnt", "wont", "wouldnt", "couldnt", "shouldnt", "cant", "cannot",
            "aint", "isnt", "wasnt", "arent", "werent", "hasnt", "havent", "hadnt",
            "lets", "thats", "whos", "whats", "heres", "theres", "wheres", "whens",
            "whys", "hows", "get", "got", "getting", "go", "going", "gone", "went",
            // call center
            "customer", "call", "called", "calling", "phone", "email", "sent", "send",
            "service", "support", "help", "request", "requested", "agent", "rep",
            "representative", "case", "ticket", "issue", "problem", "reported",
            "contacted", "contact", "inquiry", "question", "asked", "ask", "says",
            "said", "told", "tell", "please", "thank", "thanks", "regarding", "re",
            "per", "via", "etc", "ie", "eg", "hello", "hi", "dear", "sincerely",
            "regards", "best", "team", "department", "company", "received", "receive");

    private TermExtractor() {
        // utility class — not instantiable
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static boolean isSignificant(String word) {
        String normalized = normalize(word);
        return normalized.length() >= MIN_TERM_LENGTH && !STOP_WORDS.contains(normalized);
    }

    /**
     * @return unigrams in text order, followed by bigrams in text order;
     *         duplicates are kept
     */
    public static List<String> extractTerms(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        String[] words = WHITESPACE.split(normalized);

        List<String> terms = new ArrayList<>();
        for (String word : words) {
            if (isSignificant(word)) {
                terms.add(word);
            }
        }
        for (int i = 0; i < words.length - 1; i++) {
            if (isSignificant(words[i]) && isSignificant(words[i + 1])) {
                terms.add(words[i] + " " + words[i + 1]);
            }
        }
        return terms;
    }

    /**
     * @return distinct terms of {@code text}, in first-seen order
     */
    public static Set<String> distinctTerms(String text) {
        return new LinkedHashSet<>(extractTerms(text));
    }

    /**
     * Document frequency: each text contributes at most one to a term's
     * count.
     *
     * @return term counts in first-seen order
     */
    public static Map<String, Integer> documentFrequencies(List<String> texts) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String text : texts) {
            for (String term : distinctTerms(text)) {
                frequencies.merge(term, 1, Integer::sum);
            }
        }
        return frequencies;
    }
}
