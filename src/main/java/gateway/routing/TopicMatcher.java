package gateway.routing;

import java.util.Collection;

/**
 * Hierarchical topic matching with {@code /} separated segments.
 * <ul>
 *   <li>{@code +} matches one segment (an empty one included, so {@code a//c} matches {@code a/+/c})</li>
 *   <li>{@code #} matches whatever is left of the topic, wherever it appears in the pattern.
 *       Anything after it in the pattern is ignored.</li>
 * </ul>
 * Matching walks both strings character by character rather than splitting them into segments.
 */
public final class TopicMatcher {

    private TopicMatcher() { }

    public static boolean matches(String topic, String pattern) {
        if (topic == null || pattern == null) return false;

        int t = 0;
        int p = 0;
        while (true) {
            int topicLeft = topic.length() - t;
            int patternLeft = pattern.length() - p;

            if (topicLeft == patternLeft && topic.regionMatches(t, pattern, p, topicLeft)) return true;
            if (patternLeft == 0) return false;

            char pc = pattern.charAt(p);
            if (pc == '#') return true;

            if (pc == '+') {
                if (topicLeft == 0 || topic.charAt(t) == '/') {
                    // Segment closed: skip the '+' and the separator after it
                    t = Math.min(t + 1, topic.length());
                    p = Math.min(p + 2, pattern.length());
                } else {
                    t++;
                }
                continue;
            }

            if (topicLeft == 0 || topic.charAt(t) != pc) return false;
            t++;
            p++;
        }
    }

    public static boolean matchesAny(String topic, Collection<String> patterns) {
        if (patterns == null) return false;
        for (String pattern : patterns) {
            if (matches(topic, pattern)) return true;
        }
        return false;
    }
}
