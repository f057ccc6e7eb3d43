package com.bizpulse.anomaly.engine.isolationforest;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IsolationTreeTest {

    @Test
    void isolatedPoint_hasShorterPathThanClusteredPoint() {
        double[][] data = new double[64][];
        for (int i = 0; i < 63; i++) {
            data[i] = new double[]{i * 0.01};
        }
        data[63] = new double[]{100.0};

        double clustered = 0.0;
        double isolated = 0.0;
        for (long seed = 0; seed < 50; seed++) {
            IsolationTree tree = IsolationTree.build(data, 16, new Random(seed));
            clustered += tree.pathLength(new double[]{0.3});
            isolated += tree.pathLength(new double[]{100.0});
        }

        assertThat(isolated).isLessThan(clustered);
    }

    @Test
    void identicalRows_formASingleLeaf() {
        double[][] data = {{1.0, 2.0}, {1.0, 2.0}, {1.0, 2.0}, {1.0, 2.0}};

        IsolationTree tree = IsolationTree.build(data, 8, new Random(1L));

        assertThat(tree.nodeCount()).isEqualTo(1);
        assertThat(tree.pathLength(new double[]{1.0, 2.0})).isCloseTo(IsolationTree.averagePathLength(4), within(1e-12));
    }

    @Test
    void averagePathLength_smallSizes() {
        assertThat(IsolationTree.averagePathLength(1)).isZero();
        assertThat(IsolationTree.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationTree.averagePathLength(256)).isGreaterThan(IsolationTree.averagePathLength(16));
    }
}
