package com.hcltech.lineage;

import com.hcltech.lineage.exceptions.AmbiguousChainException;
import com.hcltech.lineage.exceptions.NoPreviousVersionException;
import com.hcltech.lineage.exceptions.VersionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.hcltech.lineage.LineageFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class ChainResolverTest {

    private FirmwareChain chain;

    @BeforeEach
    void setUp() {
        chain = firmware();
    }

    @Nested
    @DisplayName("findVersion")
    class FindVersion {
        @Test
        void betweenVersions_picksOlderNeighbour() {
            assertSame(chain.v1_1, ChainResolver.findVersion(chain.v1_0, "1.5"));
        }

        @Test
        void exactMatch_isInclusive() {
            assertSame(chain.v1_0, ChainResolver.findVersion(chain.v1_0, "1.0"));
            assertSame(chain.v1_1, ChainResolver.findVersion(chain.v1_0, "1.1"));
            assertSame(chain.v2_0, ChainResolver.findVersion(chain.v1_0, "2.0"));
        }

        @Test
        void newerThanAll_returnsNewest() {
            assertSame(chain.v2_0, ChainResolver.findVersion(chain.v1_0, "9.0"));
        }

        @Test
        void olderThanRoot_throws() {
            var ex = assertThrows(VersionNotFoundException.class, () -> ChainResolver.findVersion(chain.v1_0, "0.5"));
            assertEquals("0.5", ex.version());
            assertEquals("firmware", ex.hierarchy());
            assertTrue(ex.getMessage().contains("older than 1.0"), ex.getMessage());
        }

        @Test
        void olderThanRoot_withBaseFallback_returnsRoot() {
            assertSame(chain.v1_0, ChainResolver.findVersion(chain.v1_0, "0.5", Fallback.BASE));
        }

        @Test
        void baseFallback_doesNotChangeAHit() {
            assertSame(chain.v1_1, ChainResolver.findVersion(chain.v1_0, "1.9", Fallback.BASE));
        }

        @Test
        void numericSegments_compareNumerically() {
            // "1.10" is newer than "1.1" but older than "2.0"
            assertSame(chain.v1_1, ChainResolver.findVersion(chain.v1_0, "1.10"));
        }

        @Test
        void releaseCandidate_resolvesToItsRelease_notALaterVersion() {
            Hierarchy<String, String> h = Hierarchy.chain("rc", DottedVersionTC.INSTANCE);
            var v1 = h.register("1.0", null, "V1");
            var v2 = h.register("2.0", v1, "V2");
            var v2_5 = h.register("2.5", v2, "V2_5");
            h.register("3.0", v2_5, "V3");

            assertSame(v2, ChainResolver.findVersion(v1, "2.0-rc1"));
            assertSame(v2_5, ChainResolver.findVersion(v1, "2.5-hotfix"));
            assertSame(v1, ChainResolver.findVersion(v1, "1.9-rc3"));
        }

        @Test
        void canStartMidChain() {
            assertSame(chain.v2_0, ChainResolver.findVersion(chain.v1_1, "3"));
            assertThrows(VersionNotFoundException.class, () -> ChainResolver.findVersion(chain.v1_1, "1.0"));
        }

        @Test
        void repeatedQueries_returnSameNode() {
            var first = ChainResolver.findVersion(chain.v1_0, "1.5");
            for (int i = 0; i < 10; i++) assertSame(first, ChainResolver.findVersion(chain.v1_0, "1.5"));
        }

        @Test
        void singleNodeChain() {
            Hierarchy<String, String> h = Hierarchy.chain("solo", DottedVersionTC.INSTANCE);
            var only = h.register("3.2", null, "Solo");
            assertSame(only, ChainResolver.findVersion(only, "4"));
            assertThrows(VersionNotFoundException.class, () -> ChainResolver.findVersion(only, "3.1"));
        }

        @Test
        void branchOnTheWalk_isAmbiguous() {
            var deferred = firmware(deferred());
            deferred.hierarchy.register("2.1", deferred.v1_1, "FirmwareV2_1Alt");

            var ex = assertThrows(AmbiguousChainException.class,
                    () -> ChainResolver.findVersion(deferred.v1_0, "2.5"));
            assertTrue(ex.getMessage().contains("1.1"), ex.getMessage());
        }

        @Test
        void branchNotReached_isNotExamined() {
            var deferred = firmware(deferred());
            deferred.hierarchy.register("2.1", deferred.v1_1, "FirmwareV2_1Alt");
            // the walk stops at 1.0 because 1.1 is too new, so 1.1's children are never looked at
            assertSame(deferred.v1_0, ChainResolver.findVersion(deferred.v1_0, "1.0.5"));
        }
    }

    @Nested
    @DisplayName("findExactVersion")
    class FindExactVersion {
        @Test
        void findsEachVersion() {
            assertSame(chain.v1_0, ChainResolver.findExactVersion(chain.v1_0, "1.0"));
            assertSame(chain.v1_1, ChainResolver.findExactVersion(chain.v1_0, "1.1"));
            assertSame(chain.v2_0, ChainResolver.findExactVersion(chain.v1_0, "2"));
        }

        @Test
        void missingVersion_throws() {
            assertThrows(VersionNotFoundException.class, () -> ChainResolver.findExactVersion(chain.v1_0, "1.5"));
            assertThrows(VersionNotFoundException.class, () -> ChainResolver.findExactVersion(chain.v1_0, "4.0"));
            assertThrows(VersionNotFoundException.class, () -> ChainResolver.findExactVersion(chain.v2_0, "1.0"));
        }
    }

    @Test
    void latestVersion_isDeepestNode() {
        assertSame(chain.v2_0, ChainResolver.latestVersion(chain.v1_0));
        assertSame(chain.v2_0, ChainResolver.latestVersion(chain.v2_0));
    }

    @Nested
    @DisplayName("findPreviousVersion")
    class FindPreviousVersion {
        @Test
        void returnsParent() {
            assertSame(chain.v1_1, ChainResolver.findPreviousVersion(chain.v2_0));
            assertSame(chain.v1_0, ChainResolver.findPreviousVersion(chain.v1_1));
        }

        @Test
        void root_hasNoPrevious() {
            var ex = assertThrows(NoPreviousVersionException.class, () -> ChainResolver.findPreviousVersion(chain.v1_0));
            assertEquals("1.0", ex.version());
        }

        @Test
        void climbsToNamedAncestor() {
            assertSame(chain.v1_0, ChainResolver.findPreviousVersion(chain.v2_0, "1.0"));
            assertSame(chain.v1_1, ChainResolver.findPreviousVersion(chain.v2_0, "1.1"));
        }

        @Test
        void namedAncestor_excludesNodeItself() {
            assertThrows(NoPreviousVersionException.class, () -> ChainResolver.findPreviousVersion(chain.v2_0, "2.0"));
        }

        @Test
        void namedAncestor_missing_throws() {
            var ex = assertThrows(NoPreviousVersionException.class,
                    () -> ChainResolver.findPreviousVersion(chain.v2_0, "1.05"));
            assertEquals("1.05", ex.version());
        }
    }

    @Test
    void treeHierarchy_isRejected() {
        var tree = phones();
        var ex = assertThrows(IllegalArgumentException.class, () -> ChainResolver.findVersion(tree.phone, "Phone"));
        assertTrue(ex.getMessage().contains("CHAIN"), ex.getMessage());
    }

    @Test
    void strictLifecycle_requiresFreeze() {
        var strictChain = firmware(strict());
        assertThrows(IllegalStateException.class, () -> ChainResolver.findVersion(strictChain.v1_0, "1.5"));

        strictChain.hierarchy.freeze();
        assertSame(strictChain.v1_1, ChainResolver.findVersion(strictChain.v1_0, "1.5"));
    }
}
