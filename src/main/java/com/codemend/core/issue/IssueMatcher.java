package com.codemend.core.issue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural similarity between issues from different validation passes.
 *
 * Line numbers drift by one when a neighbouring line is inserted or removed,
 * and provider messages often embed identifiers that change between passes,
 * so two issues match when:
 * <ul>
 *   <li>kind and severity are equal,</li>
 *   <li>lines are at most {@value #LINE_TOLERANCE} apart, and</li>
 *   <li>normalized messages are equal, one contains the other, or their
 *       token Jaccard index is at least {@value #MESSAGE_SIMILARITY_THRESHOLD}.</li>
 * </ul>
 */
public final class IssueMatcher {

    static final int    LINE_TOLERANCE               = 1;
    static final double MESSAGE_SIMILARITY_THRESHOLD = 0.6;

    private IssueMatcher() {}

    public static boolean similar(Issue a, Issue b) {
        if (a.getKind() != b.getKind()) return false;
        if (a.getSeverity() != b.getSeverity()) return false;
        if (Math.abs(a.getLine() - b.getLine()) > LINE_TOLERANCE) return false;
        return messagesSimilar(a.getMessage(), b.getMessage());
    }

    /** True if some issue in {@code candidates} is similar to {@code issue}. */
    public static boolean hasCounterpart(Issue issue, Collection<Issue> candidates) {
        for (Issue candidate : candidates) {
            if (similar(issue, candidate)) return true;
        }
        return false;
    }

    /** Issues of {@code after} with no similar issue in {@code before}. */
    public static List<Issue> introduced(List<Issue> before, List<Issue> after) {
        List<Issue> introduced = new ArrayList<>();
        for (Issue issue : after) {
            if (!hasCounterpart(issue, before)) {
                introduced.add(issue);
            }
        }
        return introduced;
    }

    /**
     * Same size and a one-to-one pairing of similar issues. Greedy pairing is
     * enough here: similarity is tight, so ambiguous pairings are rare.
     */
    public static boolean sameIssueSet(List<Issue> a, List<Issue> b) {
        if (a.size() != b.size()) return false;
        boolean[] used = new boolean[b.size()];
        for (Issue issue : a) {
            boolean paired = false;
            for (int i = 0; i < b.size(); i++) {
                if (!used[i] && similar(issue, b.get(i))) {
                    used[i] = true;
                    paired  = true;
                    break;
                }
            }
            if (!paired) return false;
        }
        return true;
    }

    // ================================================================
    // Message comparison
    // ================================================================

    static boolean messagesSimilar(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.equals(nb)) return true;
        if (na.isEmpty() || nb.isEmpty()) return false;
        if (na.contains(nb) || nb.contains(na)) return true;
        return jaccard(tokens(na), tokens(nb)) >= MESSAGE_SIMILARITY_THRESHOLD;
    }

    static String normalize(String message) {
        if (message == null) return "";
        return message.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static Set<String> tokens(String normalized) {
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) return 1.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }
}
