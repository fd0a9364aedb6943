package com.github.rudygunawan.adaptivekv.prediction;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.time.Ticker;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Estimates the probability that a key will be hit again, from its recent access history and the
 * hour of day.
 *
 * <p>Every lookup is recorded as a labelled sample. {@link #train()} fits a logistic model to the
 * most recent samples; until the first successful fit, and whenever prediction is disabled,
 * {@link #predict(String)} returns 0.5.
 *
 * <p>Features, all roughly in [0, 1]:
 * <ol>
 *   <li>{@code (|hash(key)| mod 1000) / 1000}
 *   <li>{@code hourOfDay / 24}
 *   <li>{@code accessesInWindow / 100}
 *   <li>{@code averageIntervalMs / 3_600_000}
 *   <li>{@code min(accessesInWindow / 10, 1)}
 * </ol>
 *
 * <p>Each key keeps at most its {@value #MAX_HISTORY_PER_KEY} most recent accesses, and at most
 * {@value #MAX_TRACKED_KEYS} keys are tracked, least recently touched first out.
 *
 * <p>This class is thread-safe. Training copies the sample buffer and fits outside the monitor,
 * then swaps the new model in atomically.
 */
public class HitPredictor {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivekv.Prediction");

    static final int MAX_SAMPLES = 10_000;
    static final int MIN_TRAINING_SAMPLES = 50;
    static final int MAX_TRAINING_SAMPLES = 1_000;
    static final int MAX_HISTORY_PER_KEY = 100;
    static final int MAX_TRACKED_KEYS = 10_000;

    private static final double UNTRAINED = 0.5;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;
    private static final Deque<Long> EMPTY_HISTORY = new ArrayDeque<>(0);

    private final Ticker ticker;
    private final Clock clock;

    private final Map<String, Deque<Long>> histories = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Deque<Long>> eldest) {
            return size() > MAX_TRACKED_KEYS;
        }
    };
    private final Deque<TrainingSample> samples = new ArrayDeque<>();

    private volatile CacheConfiguration.MlPrediction settings;
    private volatile LogisticModel model;
    private final AtomicLong trainingFailures = new AtomicLong(0);

    public HitPredictor(CacheConfiguration.MlPrediction settings, Ticker ticker, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Applies new prediction settings. Recorded history and the trained model are kept.
     */
    public void configure(CacheConfiguration.MlPrediction settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    /**
     * Returns the estimated probability, in [0, 1], that {@code key} will be hit.
     */
    public double predict(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        LogisticModel current = model;
        if (!settings.isEnabled() || current == null) {
            return UNTRAINED;
        }
        double[] features;
        synchronized (this) {
            features = features(key, recentAccesses(key, nowMillis()));
        }
        double p = current.predict(features);
        return Double.isFinite(p) ? Math.max(0.0, Math.min(1.0, p)) : UNTRAINED;
    }

    /**
     * Records a lookup of {@code key}: appends to its access history and adds a training sample
     * labelled with the outcome. Does nothing while prediction is disabled.
     */
    public void recordAccess(String key, boolean hit) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!settings.isEnabled()) {
            return;
        }
        long now = nowMillis();
        synchronized (this) {
            Deque<Long> history = histories.computeIfAbsent(key, k -> new ArrayDeque<>());
            history.addLast(now);
            if (history.size() > MAX_HISTORY_PER_KEY) {
                history.removeFirst();
            }
            trim(history, now - settings.getPredictionWindowMs());
            samples.addLast(new TrainingSample(features(key, history), hit));
            while (samples.size() > MAX_SAMPLES) {
                samples.removeFirst();
            }
        }
    }

    /**
     * Drops the access history of a key that left the cache.
     */
    public synchronized void forget(String key) {
        histories.remove(key);
    }

    /**
     * Drops all access histories. Training samples and the model are kept.
     */
    public synchronized void clearHistories() {
        histories.clear();
    }

    /**
     * Removes accesses older than the prediction window, and histories left empty.
     *
     * @return the number of keys whose history was dropped
     */
    public synchronized int pruneHistories() {
        long cutoff = nowMillis() - settings.getPredictionWindowMs();
        int dropped = 0;
        Iterator<Deque<Long>> it = histories.values().iterator();
        while (it.hasNext()) {
            Deque<Long> history = it.next();
            trim(history, cutoff);
            if (history.isEmpty()) {
                it.remove();
                dropped++;
            }
        }
        return dropped;
    }

    /**
     * Fits a new model to the most recent samples if prediction is enabled and enough samples
     * have been recorded. On failure the previous model is kept.
     *
     * @return {@code true} if a new model was installed
     */
    public boolean train() {
        if (!settings.isEnabled()) {
            return false;
        }
        List<TrainingSample> batch;
        synchronized (this) {
            if (samples.size() < MIN_TRAINING_SAMPLES) {
                return false;
            }
            batch = new ArrayList<>(Math.min(samples.size(), MAX_TRAINING_SAMPLES));
            Iterator<TrainingSample> it = samples.descendingIterator();
            while (it.hasNext() && batch.size() < MAX_TRAINING_SAMPLES) {
                batch.add(it.next());
            }
        }
        return train(batch);
    }

    boolean train(List<TrainingSample> batch) {
        try {
            model = LogisticModel.fit(batch);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Hit predictor trained on " + batch.size() + " samples");
            }
            return true;
        } catch (RuntimeException e) {
            trainingFailures.incrementAndGet();
            LOGGER.log(Level.WARNING, "Hit predictor training failed, keeping previous model", e);
            return false;
        }
    }

    public boolean isTrained() {
        return model != null;
    }

    public synchronized int sampleCount() {
        return samples.size();
    }

    public synchronized int trackedKeyCount() {
        return histories.size();
    }

    synchronized int historyLength(String key) {
        Deque<Long> history = histories.get(key);
        return history == null ? 0 : history.size();
    }

    public long trainingFailureCount() {
        return trainingFailures.get();
    }

    /**
     * Returns the history of {@code key} trimmed to the prediction window, or an empty deque.
     */
    private Deque<Long> recentAccesses(String key, long now) {
        Deque<Long> history = histories.get(key);
        if (history == null) {
            return EMPTY_HISTORY;
        }
        trim(history, now - settings.getPredictionWindowMs());
        if (history.isEmpty()) {
            histories.remove(key);
        }
        return history;
    }

    private double[] features(String key, Deque<Long> history) {
        int count = history.size();
        long first = count > 0 ? history.peekFirst() : 0;
        long last = count > 0 ? history.peekLast() : 0;
        double averageInterval = count > 1 ? (double) (last - first) / (count - 1) : 0.0;
        int hour = clock.instant().atZone(clock.getZone()).getHour();

        return new double[] {
                (Math.abs((long) key.hashCode()) % 1000) / 1000.0,
                hour / 24.0,
                count / 100.0,
                averageInterval / MILLIS_PER_HOUR,
                Math.min(count / 10.0, 1.0)
        };
    }

    private static void trim(Deque<Long> history, long cutoff) {
        while (!history.isEmpty() && history.peekFirst() <= cutoff) {
            history.removeFirst();
        }
    }

    private long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read());
    }
}
