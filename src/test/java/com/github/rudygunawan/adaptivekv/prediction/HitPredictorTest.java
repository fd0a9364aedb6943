package com.github.rudygunawan.adaptivekv.prediction;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.time.FakeTicker;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HitPredictorTest {
    private final FakeTicker ticker = new FakeTicker();
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T14:00:00Z"), ZoneOffset.UTC);

    private HitPredictor predictor(boolean enabled, long windowMs) {
        CacheConfiguration.MlPrediction settings = CacheConfiguration.newBuilder()
                .predictionEnabled(enabled)
                .predictionWindowMs(windowMs)
                .build()
                .getMlPrediction();
        return new HitPredictor(settings, ticker, clock);
    }

    private void recordHotAndCold(HitPredictor predictor, int rounds) {
        for (int i = 0; i < rounds; i++) {
            predictor.recordAccess("hot", true);
            predictor.recordAccess("cold-" + i, false);
            ticker.advance(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void testUntrainedPredictsHalf() {
        HitPredictor predictor = predictor(true, 3_600_000L);

        assertFalse(predictor.isTrained());
        assertEquals(0.5, predictor.predict("anything"));
    }

    @Test
    void testNeedsMinimumSamplesToTrain() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        for (int i = 0; i < HitPredictor.MIN_TRAINING_SAMPLES - 1; i++) {
            predictor.recordAccess("k" + i, false);
        }

        assertFalse(predictor.train());
        assertFalse(predictor.isTrained());

        predictor.recordAccess("last", true);
        assertTrue(predictor.train());
        assertTrue(predictor.isTrained());
    }

    @Test
    void testTrainedModelFavoursFrequentlyHitKeys() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        recordHotAndCold(predictor, 60);

        assertTrue(predictor.train());

        double hot = predictor.predict("hot");
        double unseen = predictor.predict("never-seen");
        assertTrue(hot > unseen, "hot=" + hot + " unseen=" + unseen);
        assertTrue(hot >= 0.0 && hot <= 1.0);
        assertTrue(unseen >= 0.0 && unseen <= 1.0);
    }

    @Test
    void testDisabledPredictorIgnoresAccesses() {
        HitPredictor predictor = predictor(false, 3_600_000L);
        recordHotAndCold(predictor, 60);

        assertEquals(0, predictor.sampleCount());
        assertEquals(0, predictor.trackedKeyCount());
        assertFalse(predictor.train());
        assertEquals(0.5, predictor.predict("hot"));
    }

    @Test
    void testDisablingAfterTrainingReturnsHalf() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        recordHotAndCold(predictor, 60);
        predictor.train();

        predictor.configure(CacheConfiguration.newBuilder().predictionEnabled(false).build().getMlPrediction());

        assertEquals(0.5, predictor.predict("hot"));
        assertTrue(predictor.isTrained());
    }

    @Test
    void testFailedTrainingKeepsPreviousModel() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        recordHotAndCold(predictor, 60);
        assertTrue(predictor.train());
        double before = predictor.predict("hot");

        double[] broken = new double[5];
        Arrays.fill(broken, Double.NaN);
        List<TrainingSample> batch = new ArrayList<>();
        for (int i = 0; i < HitPredictor.MIN_TRAINING_SAMPLES; i++) {
            batch.add(new TrainingSample(broken, i % 2 == 0));
        }

        assertFalse(predictor.train(batch));
        assertEquals(1, predictor.trainingFailureCount());
        assertTrue(predictor.isTrained());
        assertEquals(before, predictor.predict("hot"));
    }

    @Test
    void testPruneDropsHistoriesOutsideWindow() {
        HitPredictor predictor = predictor(true, 1_000L);
        predictor.recordAccess("a", true);
        predictor.recordAccess("b", false);
        ticker.advance(500, TimeUnit.MILLISECONDS);
        predictor.recordAccess("b", true);
        ticker.advance(700, TimeUnit.MILLISECONDS);

        assertEquals(1, predictor.pruneHistories());
        assertEquals(1, predictor.trackedKeyCount());
    }

    @Test
    void testForgetAndClear() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        predictor.recordAccess("a", true);
        predictor.recordAccess("b", true);

        predictor.forget("a");
        assertEquals(1, predictor.trackedKeyCount());

        predictor.clearHistories();
        assertEquals(0, predictor.trackedKeyCount());
        assertEquals(2, predictor.sampleCount());
    }

    @Test
    void testHistoryIsBoundedPerKey() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        for (int i = 0; i < 250; i++) {
            predictor.recordAccess("hot", true);
            ticker.advance(1, TimeUnit.MILLISECONDS);
        }

        assertEquals(HitPredictor.MAX_HISTORY_PER_KEY, predictor.historyLength("hot"));
        assertEquals(250, predictor.sampleCount());
    }

    @Test
    void testTrackedKeysAreBounded() {
        HitPredictor predictor = predictor(true, 3_600_000L);
        int keys = HitPredictor.MAX_TRACKED_KEYS + 50;
        for (int i = 0; i < keys; i++) {
            predictor.recordAccess("miss-" + i, false);
        }

        assertEquals(HitPredictor.MAX_TRACKED_KEYS, predictor.trackedKeyCount());
        assertEquals(0, predictor.historyLength("miss-0"));
        assertEquals(1, predictor.historyLength("miss-" + (keys - 1)));
    }

    @Test
    void testPredictionTrimsExpiredHistory() {
        HitPredictor predictor = predictor(true, 1_000L);
        recordHotAndCold(predictor, 60);
        assertTrue(predictor.train());
        assertEquals(1, predictor.historyLength("hot"));

        ticker.advance(5, TimeUnit.SECONDS);
        predictor.predict("hot");

        assertEquals(0, predictor.historyLength("hot"));
    }

    @Test
    void testSampleRejectsWrongFeatureCount() {
        assertThrows(IllegalArgumentException.class, () -> new TrainingSample(new double[3], true));
    }
}
