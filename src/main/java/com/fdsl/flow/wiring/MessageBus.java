package com.fdsl.flow.wiring;

import com.fdsl.flow.api.Value;
import com.fdsl.flow.util.ErrorRateLimiter;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Per-source fan-out of external messages to every subscribed consumer, such
 * as the outbound chains of all connections bound to a shared WebSocket
 * source.
 *
 * <p>
 * Producers (connection reader threads) publish into an LMAX Disruptor ring
 * buffer; a single consumer thread delivers each message to the subscribers of
 * its source, in publication order. A subscriber that throws is logged through
 * a throttled {@link ErrorRateLimiter} and never stops the consumer thread or
 * the delivery to other subscribers.
 *
 * <p>
 * With keep-last enabled the bus remembers the latest message per source and
 * replays it to a new subscriber, unless that subscriber already received a
 * newer one.
 */
@Log4j2
public final class MessageBus implements AutoCloseable {
    static final long DRAIN_TIMEOUT_MS = 5000;

    private final Disruptor<MessageEvent> disruptor;
    private final RingBuffer<MessageEvent> ringBuffer;
    private final EventHandler<MessageEvent> handler;
    private final boolean keepLast;
    private final ErrorRateLimiter errLimiter;
    private final Map<String, List<Subscription>> subscribers = new ConcurrentHashMap<>();
    // written by the consumer thread only
    private final Map<String, Value> last = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /** Handle of one subscriber; {@link #cancel()} stops delivery. */
    public final class Subscription {
        private final String source;
        private final Consumer<Value> listener;
        // touched by the consumer thread only
        private boolean primed;

        private Subscription(String source, Consumer<Value> listener) {
            this.source = source;
            this.listener = listener;
        }

        public String source() {
            return source;
        }

        public void cancel() {
            List<Subscription> subs = subscribers.get(source);
            if (subs != null)
                subs.remove(this);
        }
    }

    /**
     * @param ringSize         ring buffer capacity, a power of two
     * @param keepLast         replay the latest message per source to new
     *                         subscribers
     * @param errorThrottleMs  minimum interval between subscriber error logs
     */
    public MessageBus(int ringSize, boolean keepLast, long errorThrottleMs) {
        this.keepLast = keepLast;
        this.errLimiter = new ErrorRateLimiter(log, errorThrottleMs);
        this.disruptor = new Disruptor<>(
                MessageEvent::new,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.handler = this::onEvent;
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.debug("Message bus started: ring={}, keepLast={}", ringSize, keepLast);
    }

    public MessageBus(int ringSize, boolean keepLast) {
        this(ringSize, keepLast, 1000);
    }

    public Subscription subscribe(String source, Consumer<Value> listener) {
        Subscription sub = new Subscription(source, listener);
        subscribers.computeIfAbsent(source, k -> new CopyOnWriteArrayList<>()).add(sub);
        if (keepLast)
            claimAndPublish(source, null, sub);
        return sub;
    }

    /** Queues a message for delivery; returns once it is in the ring buffer. */
    public void publish(String source, Value payload) {
        claimAndPublish(source, payload, null);
    }

    public int subscriberCount(String source) {
        List<Subscription> subs = subscribers.get(source);
        return subs == null ? 0 : subs.size();
    }

    /** The latest message seen on a source, or null; always null without keep-last. */
    public Value lastMessage(String source) {
        return last.get(source);
    }

    private void claimAndPublish(String source, Value payload, Subscription replayTo) {
        if (closed)
            throw new IllegalStateException("Message bus is closed");
        long seq = ringBuffer.next();
        try {
            MessageEvent event = ringBuffer.get(seq);
            if (replayTo != null)
                event.setReplay(source, replayTo, seq);
            else
                event.set(source, payload, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.isReplay()) {
                Subscription sub = event.replayTo();
                Value kept = last.get(event.source());
                if (kept != null && !sub.primed)
                    deliver(sub, kept, sequence);
                return;
            }
            if (keepLast)
                last.put(event.source(), event.payload());
            List<Subscription> subs = subscribers.get(event.source());
            if (subs == null || subs.isEmpty()) {
                log.trace("No subscriber for source {}", event.source());
                return;
            }
            for (Subscription sub : subs)
                deliver(sub, event.payload(), sequence);
        } finally {
            event.clear();
        }
    }

    private void deliver(Subscription sub, Value payload, long sequence) {
        sub.primed = true;
        try {
            sub.listener.accept(payload);
        } catch (Exception e) {
            // Do not rethrow, to keep the consumer thread alive.
            errLimiter.log(String.format("Subscriber of '%s' failed on message %d: %s", sub.source, sequence,
                    e.getMessage()), e);
        }
    }

    /**
     * Delivers everything already published, then stops the consumer thread.
     * Gives up waiting after {@value #DRAIN_TIMEOUT_MS} ms.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        long cursor = ringBuffer.getCursor();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(DRAIN_TIMEOUT_MS);
        // the consumer sequence, not its running flag: the thread may not have started yet
        while (disruptor.getSequenceValueFor(handler) < cursor) {
            if (System.nanoTime() > deadline) {
                log.warn("Message bus closed with undelivered messages: delivered {} of {}",
                        disruptor.getSequenceValueFor(handler) + 1, cursor + 1);
                break;
            }
            LockSupport.parkNanos(100_000);
        }
        disruptor.halt();
        log.debug("Message bus stopped");
    }
}
