package com.nosota.lingodesk.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword heuristics guessing the source language and subject matter of a text sample.
 * <p>
 * Deliberately rough: the results pre-fill the order form and the user can correct them.
 * </p>
 */
@Component
public class ContentClassifier {

    public static final String UNKNOWN_LANGUAGE = "Unknown (insufficient text)";
    public static final String DEFAULT_LANGUAGE = "English (default)";
    public static final String GENERAL_CONTENT = "General Content";

    static final int MIN_SAMPLE_LENGTH = 50;
    static final int MIN_SUBJECT_SCORE = 3;

    private static final Pattern NON_PRINTABLE_ASCII = Pattern.compile("[^\\x20-\\x7E]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Checked in order; the first language whose stop-word ratio exceeds its threshold wins.
     */
    private static final List<LanguagePattern> LANGUAGES = List.of(
            new LanguagePattern("English", words("the|and|or|if|in|on|at|to|for|with|by|about|is|are"), 0.04),
            new LanguagePattern("Spanish", words("el|la|los|las|y|o|si|en|con|por|para|es|son"), 0.03),
            new LanguagePattern("French", words("le|la|les|et|ou|si|dans|sur|avec|par|pour|est|sont"), 0.03),
            new LanguagePattern("German", words("der|die|das|und|oder|wenn|in|auf|mit|durch|ist|sind"), 0.03),
            new LanguagePattern("Italian", words("il|la|i|gli|le|e|o|se|in|su|con|per|sono"), 0.03)
    );

    private static final List<SubjectCategory> SUBJECTS = List.of(
            SubjectCategory.of("Technical/IT", List.of(
                    "software", "hardware", "code", "programming", "algorithm", "database", "server",
                    "computer", "network", "interface", "cloud", "api", "application", "digital", "developer",
                    "system", "technology", "platform", "framework", "function", "module")),
            SubjectCategory.of("Medical/Healthcare", List.of(
                    "health", "patient", "doctor", "hospital", "clinical", "medical", "treatment",
                    "disease", "diagnosis", "therapy", "pharmaceutical", "medicine", "symptom", "healthcare",
                    "clinic", "physician", "nurse", "drug", "prescription", "vaccine")),
            SubjectCategory.of("Legal", List.of(
                    "law", "legal", "contract", "agreement", "court", "attorney", "plaintiff",
                    "defendant", "clause", "provision", "jurisdiction", "statute", "regulation", "compliance",
                    "litigant", "paragraph", "judicial", "lawyer", "dispute", "settlement")),
            SubjectCategory.of("Financial/Business", List.of(
                    "finance", "business", "market", "investment", "profit", "revenue", "strategy",
                    "commercial", "economic", "fiscal", "budget", "corporate", "asset", "stock", "management",
                    "accounting", "capital", "financial", "transaction", "enterprise")),
            SubjectCategory.of("Marketing/Advertising", List.of(
                    "marketing", "brand", "advertising", "campaign", "consumer", "customer", "product",
                    "service", "market", "sales", "promotion", "audience", "demographic", "media", "content",
                    "creative", "advertisement", "commercial", "communication", "engagement")),
            SubjectCategory.of("Academic/Educational", List.of(
                    "research", "study", "education", "academic", "student", "university", "school",
                    "learning", "teaching", "theory", "concept", "analysis", "methodology", "science", "literature",
                    "experiment", "hypothesis", "thesis", "dissertation", "curriculum"))
    );

    /**
     * Guesses the language of a text sample from stop-word frequency.
     * Only printable ASCII characters are considered.
     *
     * @param text sample, typically the first few thousand characters of a document
     * @return language name, {@link #UNKNOWN_LANGUAGE} or {@link #DEFAULT_LANGUAGE}
     */
    public String detectLanguage(String text) {
        if (text == null) {
            return UNKNOWN_LANGUAGE;
        }
        String sample = NON_PRINTABLE_ASCII.matcher(text).replaceAll("");
        if (sample.trim().length() < MIN_SAMPLE_LENGTH) {
            return UNKNOWN_LANGUAGE;
        }

        int wordCount = WHITESPACE.split(sample).length;
        for (LanguagePattern language : LANGUAGES) {
            double ratio = (double) count(language.stopWords(), sample) / wordCount;
            if (ratio > language.threshold()) {
                return language.name();
            }
        }
        return DEFAULT_LANGUAGE;
    }

    /**
     * Picks the category with the most keyword hits. Ties keep declaration order.
     *
     * @return category name, or {@link #GENERAL_CONTENT} when the best score is below 3
     */
    public String detectSubjectMatter(String text) {
        if (text == null || text.isEmpty()) {
            return GENERAL_CONTENT;
        }
        String normalized = text.toLowerCase(Locale.ROOT);

        String best = GENERAL_CONTENT;
        int bestScore = MIN_SUBJECT_SCORE - 1;
        for (SubjectCategory category : SUBJECTS) {
            int score = category.score(normalized);
            if (score > bestScore) {
                best = category.name();
                bestScore = score;
            }
        }
        return best;
    }

    private static Pattern words(String alternatives) {
        return Pattern.compile("\\b(" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int matches = 0;
        while (matcher.find()) {
            matches++;
        }
        return matches;
    }

    private record LanguagePattern(String name, Pattern stopWords, double threshold) {
    }

    private record SubjectCategory(String name, List<Pattern> keywords) {
        static SubjectCategory of(String name, List<String> words) {
            return new SubjectCategory(name, words.stream()
                    .map(word -> Pattern.compile("\\b" + word + "\\b"))
                    .toList());
        }

        int score(String text) {
            return keywords.stream().mapToInt(keyword -> count(keyword, text)).sum();
        }
    }
}
