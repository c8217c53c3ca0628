package com.fdsl.flow.wiring;

import com.fdsl.flow.api.Value;

/**
 * Mutable holder for one external message, pre-allocated in the
 * {@link MessageBus} ring buffer and reused for its lifetime.
 *
 * Fields:
 * - source: name of the subscribe source the message arrived on.
 * - payload: the decoded message.
 * - replayTo: when set, the event replays the kept message of {@code source}
 * to this new subscriber only instead of fanning out; payload is unused.
 */
public final class MessageEvent {
    private String source;
    private Value payload;
    private MessageBus.Subscription replayTo;
    private long sequenceId;

    public void set(String source, Value payload, long seqId) {
        this.source = source;
        this.payload = payload;
        this.replayTo = null;
        this.sequenceId = seqId;
    }

    public void setReplay(String source, MessageBus.Subscription target, long seqId) {
        set(source, null, seqId);
        this.replayTo = target;
    }

    public String source() {
        return source;
    }

    public Value payload() {
        return payload;
    }

    public MessageBus.Subscription replayTo() {
        return replayTo;
    }

    public boolean isReplay() {
        return replayTo != null;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        source = null;
        payload = null;
        replayTo = null;
        sequenceId = 0;
    }
}
