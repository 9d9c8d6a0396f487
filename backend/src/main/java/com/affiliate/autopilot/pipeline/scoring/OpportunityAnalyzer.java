package com.affiliate.autopilot.pipeline.scoring;

import com.affiliate.autopilot.pipeline.model.AffiliateProgram;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content heuristics used when ranking opportunities for a campaign.
 */
@Component
public class OpportunityAnalyzer {
    public static final String APPROACH_BOTH = "BOTH";
    private static final int BOTH_APPROACH_SCORE = 85;

    private static final List<String> POSITIVE_WORDS = List.of(
        "good", "great", "excellent", "amazing", "love", "best", "awesome", "helpful"
    );
    private static final List<String> NEGATIVE_WORDS = List.of(
        "bad", "terrible", "awful", "hate", "worst", "poor", "disappointing", "problem"
    );
    private static final Map<String, Integer> URGENCY_WEIGHTS = urgencyWeights();

    private final OpportunityScorer scorer;

    public OpportunityAnalyzer(OpportunityScorer scorer) {
        this.scorer = scorer;
    }

    public String bestApproach(Opportunity opportunity) {
        if (opportunity.opportunityScore() > BOTH_APPROACH_SCORE) {
            return APPROACH_BOTH;
        }
        return scorer.actionType(
            opportunity.opportunityScore(),
            opportunity.intent(),
            opportunity.title(),
            opportunity.snippet()
        ).name();
    }

    /**
     * @return urgency from 1 to 10, 5 when no indicator is present
     */
    public int urgency(String title, String snippet) {
        String text = IntentClassifier.normalize(title, snippet);
        int urgency = 5;
        for (Map.Entry<String, Integer> entry : URGENCY_WEIGHTS.entrySet()) {
            if (text.contains(entry.getKey())) {
                urgency += entry.getValue();
            }
        }
        return Math.max(1, Math.min(10, urgency));
    }

    public String sentiment(String title, String snippet) {
        String text = IntentClassifier.normalize(title, snippet);
        boolean positive = IntentClassifier.containsAny(text, POSITIVE_WORDS);
        boolean negative = IntentClassifier.containsAny(text, NEGATIVE_WORDS);
        if (positive && negative) {
            return "mixed";
        }
        if (positive) {
            return "positive";
        }
        return negative ? "negative" : "neutral";
    }

    public String rationale(Opportunity opportunity, AffiliateProgram program, boolean categoryMatch) {
        List<String> reasons = new ArrayList<>();
        int score = opportunity.opportunityScore();
        if (score > 70) {
            reasons.add("High-quality opportunity based on search placement and content");
        } else if (score > 40) {
            reasons.add("Moderate opportunity based on search placement and content");
        } else {
            reasons.add("Lower quality opportunity based on search placement and content");
        }
        if (categoryMatch && program != null) {
            reasons.add("Community category matches the program category (" + program.category() + ")");
        } else {
            reasons.add("No direct category match between community and program");
        }
        ThreadIntent intent = opportunity.intent() == null ? ThreadIntent.GENERAL : opportunity.intent();
        switch (intent) {
            case DISCOVERY:
                reasons.add("User is actively seeking product recommendations");
                break;
            case COMPARISON:
                reasons.add("User is comparing products or solutions");
                break;
            case QUESTION:
                reasons.add("User is asking questions the product could help answer");
                break;
            case SHOWCASE:
                reasons.add("User is showcasing their experience with a product");
                break;
            default:
                reasons.add("General discussion that may be relevant to the product");
        }
        return String.join(". ", reasons) + ".";
    }

    private static Map<String, Integer> urgencyWeights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("urgent", 3);
        weights.put("asap", 3);
        weights.put("immediately", 3);
        weights.put("emergency", 3);
        weights.put("today", 2);
        weights.put("tomorrow", 2);
        weights.put("quickly", 2);
        weights.put("help!", 2);
        weights.put("deadline", 2);
        weights.put("soon", 1);
        return weights;
    }
}
