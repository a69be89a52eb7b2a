package gateway.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process broker. Several gateways in one JVM share it the same way separate processes
 * share a Redis channel.
 */
public class LocalBroker {
    // Channel -> Set of Subscribers
    private final ConcurrentHashMap<String, Set<Subscriber>> channels = new ConcurrentHashMap<>();
    // Subscriber -> Set of Channels (Reverse Index)
    private final ConcurrentHashMap<Subscriber, Set<String>> subToChannels = new ConcurrentHashMap<>();

    public interface Subscriber {
        void send(String channel, String message);
    }

    public void subscribe(String channel, Subscriber sub) {
        channels.computeIfAbsent(channel, k -> ConcurrentHashMap.newKeySet()).add(sub);
        subToChannels.computeIfAbsent(sub, k -> ConcurrentHashMap.newKeySet()).add(channel);
    }

    /**
     * @return the channels the subscriber was removed from
     */
    public List<String> unsubscribeAll(Subscriber sub) {
        Set<String> userChannels = subToChannels.remove(sub);
        List<String> removed = new ArrayList<>();
        if (userChannels != null) {
            for (String channel : userChannels) {
                channels.computeIfPresent(channel, (k, subs) -> {
                    subs.remove(sub);
                    return subs.isEmpty() ? null : subs;
                });
                removed.add(channel);
            }
        }
        return removed;
    }

    /**
     * @return number of subscribers that received the message
     */
    public int publish(String channel, String message) {
        int count = 0;
        Set<Subscriber> direct = channels.get(channel);
        if (direct != null) {
            for (Subscriber sub : direct) {
                sub.send(channel, message);
                count++;
            }
        }
        return count;
    }

    public LocalBrokerClient newClient() {
        return new LocalBrokerClient(this);
    }

    public int getNumSub(String channel) {
        Set<Subscriber> subs = channels.get(channel);
        return subs == null ? 0 : subs.size();
    }
}
