package com.affiliate.autopilot.pipeline.scoring;

import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Classifies a thread by what its author is after. Rules are checked in order and the
 * first match wins.
 */
@Component
public class IntentClassifier {
    private static final List<String> QUESTION_WORDS = List.of("what", "which");
    private static final List<String> RECOMMENDATION_WORDS = List.of("recommend", "best", "top", "suggestion");
    private static final List<String> COMPARISON_MARKERS = List.of(
        " vs ",
        " vs. ",
        "versus",
        "compared to",
        "better than",
        "difference between"
    );
    private static final List<String> SHOWCASE_MARKERS = List.of(
        "how i ",
        "i used ",
        "check out ",
        "my experience",
        "review of"
    );
    private static final List<String> DISCOVERY_PHRASES = List.of(
        "looking for",
        "need recommendation",
        "recommend",
        "suggest",
        "what is the best"
    );

    public ThreadIntent classify(String title, String body) {
        String text = normalize(title, body);
        boolean hasQuestionMark = text.indexOf('?') >= 0;
        if (hasQuestionMark && containsAny(text, QUESTION_WORDS) && containsAny(text, RECOMMENDATION_WORDS)) {
            return ThreadIntent.DISCOVERY;
        }
        if (hasQuestionMark) {
            return ThreadIntent.QUESTION;
        }
        if (containsAny(text, COMPARISON_MARKERS)) {
            return ThreadIntent.COMPARISON;
        }
        if (containsAny(text, SHOWCASE_MARKERS)) {
            return ThreadIntent.SHOWCASE;
        }
        if (containsAny(text, DISCOVERY_PHRASES)) {
            return ThreadIntent.DISCOVERY;
        }
        return ThreadIntent.GENERAL;
    }

    // Padded so markers with surrounding spaces also match at the edges.
    static String normalize(String title, String body) {
        String safeTitle = title == null ? "" : title;
        String safeBody = body == null ? "" : body;
        return (" " + safeTitle + " " + safeBody + " ").toLowerCase(Locale.ROOT);
    }

    static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
