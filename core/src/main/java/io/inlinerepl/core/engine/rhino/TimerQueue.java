package io.inlinerepl.core.engine.rhino;

import java.util.HashSet;
import java.util.PriorityQueue;
import java.util.Set;
import org.mozilla.javascript.Callable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Virtual-time timers. Callbacks never wait for wall-clock time: after the main body finished,
 * {@link #drain} fires them in due-time order (registration order on ties), advancing a virtual
 * clock, and drains promise jobs after each one.
 */
final class TimerQueue {

    private static final Logger LOG = LoggerFactory.getLogger(TimerQueue.class);

    private final PriorityQueue<Timer> queue = new PriorityQueue<>();
    private final Set<Integer> cleared = new HashSet<>();
    private final int maxFirings;
    private long now;
    private int nextId = 1;
    private long sequence;

    TimerQueue(int maxFirings) {
        this.maxFirings = maxFirings;
    }

    int schedule(Callable callback, long delayMs, Object[] args, boolean repeat) {
        int id = nextId++;
        long delay = Math.max(0, delayMs);
        queue.add(new Timer(id, callback, args, now + delay, repeat ? Math.max(1, delay) : -1, sequence++));
        return id;
    }

    void clear(int id) {
        cleared.add(id);
    }

    /**
     * Fires due timers until none remain or the firing cap is reached.
     *
     * @return number of callbacks fired
     */
    int drain(Context cx, Scriptable scope) {
        int fired = 0;
        while (!queue.isEmpty()) {
            Timer timer = queue.poll();
            if (cleared.contains(timer.id())) {
                continue;
            }
            if (fired >= maxFirings) {
                LOG.warn("timers.capped fired={} pending={}", fired, queue.size() + 1);
                queue.clear();
                break;
            }
            now = timer.due();
            if (timer.interval() > 0) {
                queue.add(new Timer(
                        timer.id(), timer.callback(), timer.args(), now + timer.interval(), timer.interval(), sequence++));
            }
            fired++;
            timer.callback().call(cx, scope, scope, timer.args());
            cx.processMicrotasks();
        }
        return fired;
    }

    private record Timer(int id, Callable callback, Object[] args, long due, long interval, long sequence)
            implements Comparable<Timer> {

        @Override
        public int compareTo(Timer other) {
            int byDue = Long.compare(due, other.due);
            return byDue != 0 ? byDue : Long.compare(sequence, other.sequence);
        }
    }
}
