package com.affiliate.autopilot.pipeline.scoring;

import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentClassifierTest {
    private final IntentClassifier classifier = new IntentClassifier();

    @Test
    void recommendationQuestionIsDiscovery() {
        assertThat(classifier.classify("What is the best budget laptop?", ""))
            .isEqualTo(ThreadIntent.DISCOVERY);
        assertThat(classifier.classify("WHICH monitor would you RECOMMEND?", null))
            .isEqualTo(ThreadIntent.DISCOVERY);
    }

    @Test
    void otherQuestionsAreQuestions() {
        assertThat(classifier.classify("How do I reset my router?", "It keeps dropping"))
            .isEqualTo(ThreadIntent.QUESTION);
        assertThat(classifier.classify("Which one is better than the old model?", ""))
            .isEqualTo(ThreadIntent.QUESTION);
    }

    @Test
    void comparisonMarkersWithoutQuestionMark() {
        assertThat(classifier.classify("iPhone vs Pixel camera", "")).isEqualTo(ThreadIntent.COMPARISON);
        assertThat(classifier.classify("Notion", "difference between notion and obsidian"))
            .isEqualTo(ThreadIntent.COMPARISON);
    }

    @Test
    void showcaseBeforeDiscoveryPhrases() {
        assertThat(classifier.classify("How I built my home gym", "I recommend starting small"))
            .isEqualTo(ThreadIntent.SHOWCASE);
        assertThat(classifier.classify("My experience with standing desks", ""))
            .isEqualTo(ThreadIntent.SHOWCASE);
    }

    @Test
    void discoveryPhrasesWithoutQuestionMark() {
        assertThat(classifier.classify("Looking for a simple CRM", "")).isEqualTo(ThreadIntent.DISCOVERY);
        assertThat(classifier.classify("Please suggest a VPN", "")).isEqualTo(ThreadIntent.DISCOVERY);
    }

    @Test
    void everythingElseIsGeneral() {
        assertThat(classifier.classify("Weekly discussion thread", "Talk about anything"))
            .isEqualTo(ThreadIntent.GENERAL);
        assertThat(classifier.classify(null, null)).isEqualTo(ThreadIntent.GENERAL);
    }
}
