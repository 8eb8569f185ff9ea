package com.healthbud.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local sliding-window request counter keyed by (bucket, client key).
 *
 * <p>One instance is created at startup and handed to every request handler. The whole
 * prune, decide and record sequence runs under a single lock, so concurrent callers can never
 * push a key past {@code maxRequests} admissions inside one window.
 *
 * <p>Keys are never evicted; an idle client keeps an (empty after pruning) deque for the
 * lifetime of the process.
 */
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<BucketKey, Deque<Instant>> admitted = new HashMap<>();

    public SlidingWindowRateLimiter() {
        this(Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Checks and, when admitted, records one request.
     *
     * @param maxRequests   admissions allowed per window; zero or less disables limiting
     * @param windowSeconds length of the trailing window
     */
    public Admission admit(String bucket, String clientKey, int maxRequests, int windowSeconds) {
        if (maxRequests <= 0) {
            return Admission.ADMITTED;
        }

        BucketKey key = new BucketKey(bucket, clientKey == null ? ClientKeys.UNKNOWN : clientKey);
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofSeconds(windowSeconds));

        lock.lock();
        try {
            Deque<Instant> entries = admitted.computeIfAbsent(key, k -> new ArrayDeque<>());
            while (!entries.isEmpty() && entries.peekFirst().isBefore(windowStart)) {
                entries.pollFirst();
            }

            if (entries.size() >= maxRequests) {
                log.debug("Rate limit reached for {}:{} ({} in {}s)", bucket, key.clientKey, entries.size(), windowSeconds);
                return Admission.REJECTED;
            }

            // clock may step backwards; keep the deque ordered
            Instant last = entries.peekLast();
            entries.addLast(last != null && last.isAfter(now) ? last : now);
            return Admission.ADMITTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Boolean form used by the HTTP layer.
     */
    public boolean tryAdmit(String bucket, String clientKey, int maxRequests, int windowSeconds) {
        return admit(bucket, clientKey, maxRequests, windowSeconds).isAdmitted();
    }

    /**
     * Number of timestamps currently held for a key, without pruning.
     */
    public int recordedCount(String bucket, String clientKey) {
        lock.lock();
        try {
            Deque<Instant> entries = admitted.get(new BucketKey(bucket, clientKey));
            return entries == null ? 0 : entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int trackedKeyCount() {
        lock.lock();
        try {
            return admitted.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class BucketKey {
        private final String bucket;
        private final String clientKey;

        private BucketKey(String bucket, String clientKey) {
            this.bucket = Objects.requireNonNull(bucket, "bucket");
            this.clientKey = clientKey;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BucketKey)) return false;
            BucketKey other = (BucketKey) o;
            return bucket.equals(other.bucket) && Objects.equals(clientKey, other.clientKey);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bucket, clientKey);
        }
    }
}
