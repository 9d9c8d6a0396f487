package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.model.AffiliateProgram;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Picks the affiliate program a thread is most relevant to: a program name mention weighs
 * 50, its category 30 and any of its tags 10.
 */
@Component
public class AffiliateProgramMatcher {

    public Long bestMatch(List<AffiliateProgram> programs, String title, String snippet) {
        if (programs == null || programs.isEmpty()) {
            return null;
        }
        String text = ((title == null ? "" : title) + " " + (snippet == null ? "" : snippet)).toLowerCase(Locale.ROOT);
        Long bestId = null;
        int bestRelevance = 0;
        for (AffiliateProgram program : programs) {
            int relevance = relevance(program, text);
            if (relevance > bestRelevance) {
                bestRelevance = relevance;
                bestId = program.id();
            }
        }
        return bestId;
    }

    int relevance(AffiliateProgram program, String text) {
        int relevance = 0;
        if (mentions(text, program.name())) {
            relevance += 50;
        }
        if (mentions(text, program.category())) {
            relevance += 30;
        }
        if (program.tags() != null && program.tags().stream().anyMatch(tag -> mentions(text, tag))) {
            relevance += 10;
        }
        return relevance;
    }

    private boolean mentions(String text, String term) {
        return term != null && !term.isBlank() && text.contains(term.trim().toLowerCase(Locale.ROOT));
    }
}
