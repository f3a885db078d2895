package com.hcltech.lineage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.hcltech.lineage.LineageFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/** Many threads resolving against frozen hierarchies always see the same nodes. */
class ConcurrentResolutionTest {

    @Test
    void parallelLookups_afterFreeze_agree() throws Exception {
        var chain = firmware(strict());
        var tree = phones();
        chain.hierarchy.freeze();
        tree.hierarchy.freeze();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int t = 0; t < 64; t++) {
                tasks.add(() -> {
                    for (int i = 0; i < 500; i++) {
                        if (ChainResolver.findVersion(chain.v1_0, "1.5") != chain.v1_1) return false;
                        if (ChainResolver.findVersion(chain.v1_0, "9.0") != chain.v2_0) return false;
                        if (TreeResolver.findModel(tree.phone, "iPhone7") != tree.iPhone7) return false;
                        if (TreeResolver.findModel(tree.phone, "A1549") != tree.iPhone6) return false;
                    }
                    return true;
                });
            }
            for (Future<Boolean> f : pool.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                assertTrue(f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
