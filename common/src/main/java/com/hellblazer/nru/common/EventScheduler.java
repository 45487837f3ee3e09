/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the NR-U BWP Manager.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.nru.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Single-threaded discrete event scheduler driving one logical clock.
 * <p>
 * Events are held in a priority queue keyed by simulated time. Events scheduled for the same instant run in
 * the order they were scheduled (FIFO), so a run is fully reproducible from its seed. Each event runs to
 * completion before the next one starts; handlers may schedule further events, including at the current
 * instant.
 * <p>
 * Events are never cancelled. A recurring process that outlives the object it refers to must validate its
 * target when it fires and do nothing if the target is gone.
 * <p>
 * Usage:
 * <pre>
 * var scheduler = new EventScheduler();
 * scheduler.schedule(SimTime.millis(1), "tick", () -> log.info("tick at {}", scheduler.now()));
 * scheduler.runUntil(SimTime.seconds(1));
 * </pre>
 *
 * @author hal.hildebrand
 */
public class EventScheduler implements SimClock {
    private static final Logger log = LoggerFactory.getLogger(EventScheduler.class);

    private record ScheduledEvent(long time, long sequence, String label, Runnable action) {
    }

    private final PriorityQueue<ScheduledEvent> queue;
    private long                                now;
    private long                                sequence;
    private long                                executed;

    public EventScheduler() {
        this.queue = new PriorityQueue<>(
        Comparator.comparingLong(ScheduledEvent::time).thenComparingLong(ScheduledEvent::sequence));
    }

    @Override
    public long now() {
        return now;
    }

    /**
     * Schedule an action after a delay relative to now.
     *
     * @param delay  non-negative delay in nanoseconds
     * @param label  short description used in trace logging
     * @param action the handler
     * @return the absolute firing time
     */
    public long schedule(long delay, String label, Runnable action) {
        if (delay < 0) {
            throw new IllegalArgumentException("Delay must be non-negative: " + delay);
        }
        return scheduleAt(Math.addExact(now, delay), label, action);
    }

    public long schedule(long delay, Runnable action) {
        return schedule(delay, "event", action);
    }

    /**
     * Schedule an action at an absolute simulated time.
     *
     * @param time   firing time, not earlier than now
     * @param label  short description used in trace logging
     * @param action the handler
     * @return the firing time
     */
    public long scheduleAt(long time, String label, Runnable action) {
        if (time < now) {
            throw new IllegalArgumentException("Cannot schedule in the past: " + time + " < " + now);
        }
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        queue.add(new ScheduledEvent(time, sequence++, label, action));
        return time;
    }

    /**
     * Execute the earliest pending event.
     *
     * @return true if an event ran, false if the queue was empty
     */
    public boolean runNext() {
        var event = queue.poll();
        if (event == null) {
            return false;
        }
        now = event.time();
        if (log.isTraceEnabled()) {
            log.trace("t={} run {} #{}", now, event.label(), event.sequence());
        }
        executed++;
        event.action().run();
        return true;
    }

    /**
     * Run every event whose time is at or before {@code endTime}, then advance the clock to {@code endTime}.
     *
     * @param endTime absolute simulated time to stop at
     * @return number of events executed
     */
    public long runUntil(long endTime) {
        if (endTime < now) {
            throw new IllegalArgumentException("End time is in the past: " + endTime + " < " + now);
        }
        long before = executed;
        while (!queue.isEmpty() && queue.peek().time() <= endTime) {
            runNext();
        }
        now = endTime;
        return executed - before;
    }

    /**
     * Run until no events remain. Only terminates if every recurring process eventually stops rescheduling.
     *
     * @return number of events executed
     */
    public long runAll() {
        long before = executed;
        while (runNext()) {
            // drain
        }
        return executed - before;
    }

    public int pending() {
        return queue.size();
    }

    public long executed() {
        return executed;
    }

    /**
     * @return the firing time of the earliest pending event, or {@link Long#MAX_VALUE} if none
     */
    public long nextEventTime() {
        var head = queue.peek();
        return head == null ? Long.MAX_VALUE : head.time();
    }

    @Override
    public String toString() {
        return String.format("EventScheduler{now=%d, pending=%d, executed=%d}", now, queue.size(), executed);
    }
}
