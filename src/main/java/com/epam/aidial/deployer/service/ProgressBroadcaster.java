package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.data.ProgressEvent;
import com.epam.aidial.deployer.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Fans out progress of deployments and sessions to live subscribers.
 *
 * <p>Every topic keeps the last known snapshot of its record. A new subscriber receives a {@code connected} event
 * with the snapshot, then the events published after it, then a single {@code done} event. Finished topics are kept
 * in a bounded backlog, so late subscribers still get the final state without touching the store.</p>
 *
 * <p>Publishing never fails: a subscriber that throws is logged and detached.</p>
 */
@Slf4j
public class ProgressBroadcaster {

    private final Map<String, Topic> topics = new ConcurrentHashMap<>();
    private final Map<String, Boolean> backlog = new LinkedHashMap<>();
    private final HeartbeatService heartbeatService;
    private final int backlogSize;

    public ProgressBroadcaster(HeartbeatService heartbeatService, JsonObject settings) {
        this.heartbeatService = heartbeatService;
        this.backlogSize = settings.getInteger("backlogSize", 256);
    }

    public void open(String id, Object snapshot) {
        JsonNode tree = JsonUtil.convertToTree(snapshot);
        Topic topic = topics.computeIfAbsent(id, Topic::new);
        synchronized (topic) {
            topic.snapshot = tree;
        }
    }

    /**
     * Delivers a progress or error event to the current subscribers.
     *
     * @param snapshot new state of the record or null if it did not change
     */
    public void publish(String id, @Nullable Object snapshot, ProgressEvent event) {
        JsonNode tree = JsonUtil.convertToTree(snapshot);
        Topic topic = topics.computeIfAbsent(id, Topic::new);

        synchronized (topic) {
            if (tree != null) {
                topic.snapshot = tree;
            }

            // finished topics only follow the state for late subscribers
            if (topic.done != null) {
                return;
            }

            for (Subscription subscription : topic.subscriptions) {
                subscription.deliver(event);
            }
        }
    }

    /**
     * Finishes the topic: current subscribers receive the done event and are detached.
     * Completing a finished topic replaces its final state for late subscribers only.
     */
    public void complete(String id, Object snapshot, ProgressEvent done) {
        JsonNode tree = JsonUtil.convertToTree(snapshot);
        Topic topic = topics.computeIfAbsent(id, Topic::new);
        boolean first;

        synchronized (topic) {
            topic.snapshot = tree;
            first = (topic.done == null);
            topic.done = done;

            if (first) {
                for (Subscription subscription : topic.subscriptions) {
                    subscription.deliver(done);
                    subscription.close();
                }
            }
        }

        if (first) {
            remember(id);
        }
    }

    /**
     * @param fallback the state of the record when the topic is unknown, for example after a restart
     */
    public Subscription subscribe(String id, Supplier<Snapshot> fallback, Consumer<ProgressEvent> subscriber) {
        Topic topic = topics.get(id);
        if (topic == null) {
            Snapshot snapshot = fallback.get();
            topic = topics.computeIfAbsent(id, key -> fromSnapshot(key, snapshot));
            if (topic.done != null) {
                remember(id);
            }
        }

        Subscription subscription = new Subscription(topic, subscriber);
        synchronized (topic) {
            subscription.deliver(ProgressEvent.connected(id, topic.snapshot));

            if (topic.done != null) {
                subscription.deliver(topic.done);
                subscription.close();
                return subscription;
            }

            topic.subscriptions.add(subscription);
            heartbeatService.subscribe(subscription.heartbeat);
        }

        return subscription;
    }

    public int subscriberCount(String id) {
        Topic topic = topics.get(id);
        return (topic == null) ? 0 : topic.subscriptions.size();
    }

    private void unsubscribe(Subscription subscription) {
        Topic topic = subscription.topic;
        synchronized (topic) {
            topic.subscriptions.remove(subscription);
        }
        heartbeatService.unsubscribe(subscription.heartbeat);
    }

    private void remember(String id) {
        synchronized (backlog) {
            backlog.put(id, Boolean.TRUE);

            Iterator<String> iterator = backlog.keySet().iterator();
            while (backlog.size() > backlogSize && iterator.hasNext()) {
                String evicted = iterator.next();
                iterator.remove();
                topics.computeIfPresent(evicted, (key, topic) -> topic.isFinished() ? null : topic);
            }
        }
    }

    private static Topic fromSnapshot(String id, Snapshot snapshot) {
        Topic topic = new Topic(id);
        topic.snapshot = JsonUtil.convertToTree(snapshot.state());
        if (snapshot.finalStatus() != null) {
            topic.done = ProgressEvent.done(id, snapshot.finalStatus()).setError(snapshot.error());
        }
        return topic;
    }

    /**
     * State of a record as stored.
     *
     * @param finalStatus status of a finished record, null while it is in progress
     */
    public record Snapshot(Object state, @Nullable String finalStatus, @Nullable String error) {
    }

    private static class Topic {
        final String id;
        final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
        JsonNode snapshot;
        ProgressEvent done;

        Topic(String id) {
            this.id = id;
        }

        synchronized boolean isFinished() {
            return done != null;
        }
    }

    public class Subscription implements AutoCloseable {

        private final AtomicBoolean active = new AtomicBoolean(true);
        private final Topic topic;
        private final Consumer<ProgressEvent> subscriber;
        private final Runnable heartbeat = () -> deliver(ProgressEvent.heartbeat());

        private Subscription(Topic topic, Consumer<ProgressEvent> subscriber) {
            this.topic = topic;
            this.subscriber = subscriber;
        }

        public boolean isActive() {
            return active.get();
        }

        private void deliver(ProgressEvent event) {
            boolean failed = false;

            synchronized (this) {
                if (!active.get()) {
                    return;
                }

                try {
                    subscriber.accept(event);
                    heartbeatService.touch(heartbeat);
                } catch (Throwable e) {
                    log.warn("Can't notify subscriber of {}", topic.id, e);
                    failed = true;
                }
            }

            if (failed) {
                close();
            }
        }

        @Override
        public void close() {
            if (active.getAndSet(false)) {
                unsubscribe(this);
            }
        }
    }
}
