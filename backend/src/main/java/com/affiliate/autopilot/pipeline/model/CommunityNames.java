package com.affiliate.autopilot.pipeline.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CommunityNames {
    private static final Pattern THREAD_COMMUNITY = Pattern.compile("reddit\\.com/r/([^/?#]+)", Pattern.CASE_INSENSITIVE);

    private CommunityNames() {
    }

    /**
     * Lower-cases a community name and strips a leading {@code r/} or {@code /r/}.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String value = name.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("/")) {
            value = value.substring(1);
        }
        if (value.startsWith("r/")) {
            value = value.substring(2);
        }
        return value;
    }

    /**
     * Community named in a thread URL such as {@code https://www.reddit.com/r/foo/comments/x/y},
     * or an empty string.
     */
    public static String fromThreadUrl(String url) {
        if (url == null) {
            return "";
        }
        Matcher matcher = THREAD_COMMUNITY.matcher(url);
        return matcher.find() ? matcher.group(1) : "";
    }
}
