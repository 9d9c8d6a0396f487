package com.affiliate.autopilot.pipeline.scoring;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.ActionType;
import com.affiliate.autopilot.pipeline.model.AffiliateProgram;
import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class OpportunityScorer {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    private static final int LONG_SNIPPET_CHARS = 100;
    private static final List<String> HIGH_VALUE_PHRASES = List.of(
        "recommend",
        "suggestion",
        "alternative",
        "best",
        "top",
        "review",
        "opinion",
        "experience",
        "worth it",
        "help me choose"
    );
    private static final List<String> URGENCY_PHRASES = List.of(
        "urgent",
        "asap",
        "today",
        "need help",
        "quickly"
    );
    private static final List<String> COMMENT_INVITATIONS = List.of(
        "anyone recommend",
        "what should i",
        "help me",
        "looking for",
        "need advice",
        "which one",
        "alternative to"
    );

    private final AutopilotProperties properties;

    public OpportunityScorer(AutopilotProperties properties) {
        this.properties = properties;
    }

    /**
     * Scores a discovered thread from its search rank and content. Higher ranks (lower
     * numbers) and recommendation-seeking threads score best.
     */
    public int score(int rank, ThreadIntent intent, String title, String snippet) {
        int score = Math.max(0, 10 - rank) * 5;
        score += intentBonus(intent);
        String text = IntentClassifier.normalize(title, snippet);
        if (snippet != null && snippet.length() > LONG_SNIPPET_CHARS) {
            score += 5;
        }
        if (IntentClassifier.containsAny(text, HIGH_VALUE_PHRASES)) {
            score += 5;
        }
        if (IntentClassifier.containsAny(text, URGENCY_PHRASES)) {
            score += 5;
        }
        return clamp(score);
    }

    /**
     * Campaign-aware score: half of the base score plus bonuses for a matching community
     * category, the thread intent and mentions of the program name or tags.
     */
    public int affinity(int baseScore, ThreadIntent intent, boolean categoryMatch, AffiliateProgram program, String text) {
        double score = baseScore * 0.5;
        if (categoryMatch) {
            score += 20;
        }
        score += intentBonus(intent);
        if (program != null) {
            String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
            String name = program.name() == null ? "" : program.name().trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty() && haystack.contains(name)) {
                score += 15;
            }
            if (program.tags() != null && program.tags().stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .anyMatch(tag -> haystack.contains(tag.trim().toLowerCase(Locale.ROOT)))) {
                score += 5;
            }
        }
        return clamp((int) Math.round(score));
    }

    public ActionType actionType(int score, ThreadIntent intent, String title, String snippet) {
        ThreadIntent safeIntent = intent == null ? ThreadIntent.GENERAL : intent;
        int threshold = properties.getPipeline().getPostActionThreshold();
        switch (safeIntent) {
            case DISCOVERY:
            case QUESTION:
                return ActionType.COMMENT;
            case SHOWCASE:
                return ActionType.POST;
            case COMPARISON:
                return score > threshold ? ActionType.POST : ActionType.COMMENT;
            default:
                String text = IntentClassifier.normalize(title, snippet);
                if (IntentClassifier.containsAny(text, COMMENT_INVITATIONS)) {
                    return ActionType.COMMENT;
                }
                return score > threshold ? ActionType.POST : ActionType.COMMENT;
        }
    }

    private int intentBonus(ThreadIntent intent) {
        return intent == null ? 0 : intent.scoreBonus();
    }

    private int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
