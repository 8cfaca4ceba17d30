package com.agenttrader.core.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RandomForestRegressor Tests")
class RandomForestRegressorTest {

    private static double[][] stepInputs(int n) {
        double[][] x = new double[n][];
        for (int i = 0; i < n; i++) {
            x[i] = new double[] {i, (i * 7) % 3};
        }
        return x;
    }

    private static double[] stepTargets(int n) {
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = i < n / 2 ? 0.0 : 10.0;
        }
        return y;
    }

    @Test
    @DisplayName("A depth-1 tree finds the step exactly")
    void testTreeFindsStep() {
        int[] all = new int[10];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        double[] importance = new double[2];

        RegressionTree tree = RegressionTree.grow(stepInputs(10), stepTargets(10), all,
            new RegressionTree.Params(1, 1, 2), importance);

        assertThat(tree.nodeCount()).isEqualTo(3);
        assertThat(tree.predict(new double[] {2, 0})).isEqualTo(0.0);
        assertThat(tree.predict(new double[] {7, 0})).isEqualTo(10.0);
        assertThat(importance[0]).isPositive();
        assertThat(importance[1]).isZero();
    }

    @Test
    @DisplayName("Minimum leaf size stops splits that would isolate single samples")
    void testMinLeaf() {
        int[] all = {0, 1, 2, 3};
        double[][] x = {{0}, {1}, {2}, {3}};
        double[] y = {0, 0, 0, 100};

        RegressionTree tree = RegressionTree.grow(x, y, all, new RegressionTree.Params(5, 2, 2), new double[1]);

        // best split must keep 2 samples per side: {0,1} | {2,3}
        assertThat(tree.predict(new double[] {3})).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Same seed, same forest")
    void testDeterministic() {
        var settings = new RandomForestRegressor.Settings(15, 6, 2, 5, 42);
        var a = RandomForestRegressor.fit(stepInputs(60), stepTargets(60), settings, () -> false);
        var b = RandomForestRegressor.fit(stepInputs(60), stepTargets(60), settings, () -> false);

        double[] probe = {33.5, 1};
        assertThat(a.predictEach(probe)).containsExactly(b.predictEach(probe));
        assertThat(a.importances()).containsExactly(b.importances());
    }

    @Test
    @DisplayName("Forest mean approximates the step")
    void testLearnsStep() {
        var settings = new RandomForestRegressor.Settings(25, 6, 2, 5, 7);
        var forest = RandomForestRegressor.fit(stepInputs(60), stepTargets(60), settings, () -> false);

        assertThat(forest.predict(new double[] {5, 0})).isCloseTo(0.0, within(1.0));
        assertThat(forest.predict(new double[] {55, 0})).isCloseTo(10.0, within(1.0));
        assertThat(forest.trees()).hasSize(25);
        assertThat(forest.importances()[0]).isGreaterThan(forest.importances()[1]);
    }

    @Test
    @DisplayName("Cancellation is honoured between trees")
    void testCancellation() {
        var settings = new RandomForestRegressor.Settings(50, 4, 2, 5, 1);
        AtomicInteger polls = new AtomicInteger();

        assertThatThrownBy(() -> RandomForestRegressor.fit(stepInputs(40), stepTargets(40), settings,
            () -> polls.incrementAndGet() > 3))
            .isInstanceOf(CancellationException.class);
        assertThat(polls.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("Wrong input width is rejected")
    void testInputWidth() {
        var settings = new RandomForestRegressor.Settings(3, 3, 1, 2, 1);
        var forest = RandomForestRegressor.fit(stepInputs(20), stepTargets(20), settings, () -> false);

        assertThatThrownBy(() -> forest.predict(new double[] {1}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
