package com.dataset_analyzer.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits generated text into insight statements and one recommendation.
 * <ul>
 *   <li>The text is cut at the first {@code RECOMMENDATION:} marker, case-insensitive.</li>
 *   <li>Insights are the lines before the marker that start with {@code -}, {@code *} or {@code •},
 *       without the bullet. Blank ones are skipped and at most {@code maxInsights} are kept.</li>
 *   <li>The recommendation is everything after the marker with whitespace collapsed,
 *       or {@code null} when there is no marker or nothing follows it.</li>
 * </ul>
 */
public final class InsightResponseParser {

    private static final Pattern RECOMMENDATION_MARKER = Pattern.compile("RECOMMENDATION\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern BULLET = Pattern.compile("^[-*•]+\\s*");

    private InsightResponseParser() {
    }

    public record ParsedInsights(List<String> insights, String recommendation) {

        public ParsedInsights {
            insights = List.copyOf(insights);
        }

        public boolean hasInsights() {
            return !insights.isEmpty();
        }
    }

    public static ParsedInsights parse(String text, int maxInsights) {
        if (text == null || text.isBlank()) {
            return new ParsedInsights(List.of(), null);
        }

        String insightPart = text;
        String recommendation = null;
        Matcher marker = RECOMMENDATION_MARKER.matcher(text);
        if (marker.find()) {
            insightPart = text.substring(0, marker.start());
            String tail = text.substring(marker.end()).replaceAll("\\s+", " ").trim();
            recommendation = tail.isEmpty() ? null : tail;
        }

        List<String> insights = new ArrayList<>();
        for (String line : insightPart.split("\\R")) {
            String trimmed = line.trim();
            if (!BULLET.matcher(trimmed).find()) {
                continue;
            }
            String statement = BULLET.matcher(trimmed).replaceFirst("").trim();
            if (!statement.isEmpty()) {
                insights.add(statement);
            }
            if (insights.size() == maxInsights) {
                break;
            }
        }
        return new ParsedInsights(insights, recommendation);
    }
}
