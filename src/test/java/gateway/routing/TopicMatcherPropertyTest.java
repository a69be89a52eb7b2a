package gateway.routing;

import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;

public class TopicMatcherPropertyTest {

    @Provide
    Arbitrary<List<String>> segments() {
        return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(6)
                .list().ofMinSize(1).ofMaxSize(6);
    }

    @Property
    boolean topicMatchesItself(@ForAll("segments") List<String> segments) {
        String topic = String.join("/", segments);
        return TopicMatcher.matches(topic, topic);
    }

    @Property
    boolean anyPrefixFollowedByHashMatches(@ForAll("segments") List<String> segments, @ForAll("cut") int cut) {
        String topic = String.join("/", segments);
        String prefix = topic.substring(0, Math.min(cut, topic.length()));
        return TopicMatcher.matches(topic, prefix + "#");
    }

    @Property
    boolean plusReplacesAnySingleSegment(@ForAll("segments") List<String> segments, @ForAll("cut") int index) {
        List<String> pattern = new ArrayList<>(segments);
        pattern.set(index % segments.size(), "+");
        return TopicMatcher.matches(String.join("/", segments), String.join("/", pattern));
    }

    @Property
    boolean longerPatternNeverMatches(@ForAll("segments") List<String> segments) {
        String topic = String.join("/", segments);
        return !TopicMatcher.matches(topic, topic + "/extra");
    }

    @Provide
    Arbitrary<Integer> cut() {
        return Arbitraries.integers().between(0, 50);
    }
}
