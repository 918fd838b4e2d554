package com.z2api.pool.credential;

import com.z2api.common.dto.PoolSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCredentialPoolTest {

    @Nested
    @DisplayName("rotation")
    class Rotation {

        @Test
        void emptyPoolYieldsNothing() {
            assertThat(new InMemoryCredentialPool().acquire()).isEmpty();
        }

        @Test
        void fullRoundReturnsEveryTokenOnceInOrderAndCursorReturnsToStart() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(
                    List.of("tokA", "u@e.com----pw----tokB", "tokC"));
            pool.acquire();
            int start = pool.cursor();

            List<String> round = new ArrayList<>();
            for (int i = 0; i < pool.size(); i++) {
                round.add(pool.acquire().orElseThrow());
            }

            assertThat(round).containsExactly("tokB", "tokC", "tokA");
            assertThat(pool.cursor()).isEqualTo(start);
        }

        @Test
        void duplicatesAreKeptAndRotatedIndependently() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokA", "tokB"));

            assertThat(pool.size()).isEqualTo(3);
            assertThat(List.of(pool.acquire().orElseThrow(), pool.acquire().orElseThrow(), pool.acquire().orElseThrow()))
                    .containsExactly("tokA", "tokA", "tokB");
        }

        @Test
        void failedEntryIsSkippedUntilMarkedSuccessful() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokB", "tokC"));
            pool.markFailed("tokB");

            List<String> seen = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                seen.add(pool.acquire().orElseThrow());
            }
            assertThat(seen).doesNotContain("tokB");

            pool.markSuccess("tokB");
            seen.clear();
            for (int i = 0; i < 3; i++) {
                seen.add(pool.acquire().orElseThrow());
            }
            assertThat(seen).contains("tokB");
        }

        @Test
        void exhaustedPoolClearsFailuresAndRestartsAtFirstEntry() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokB", "tokC"));
            pool.acquire();
            pool.markFailed("tokA");
            pool.markFailed("tokB");
            pool.markFailed("tokC");

            assertThat(pool.acquire()).contains("tokA");
            assertThat(pool.failedCount()).isZero();

            pool.markFailed("tokC");
            assertThat(pool.failedEntries()).containsExactly("tokC");
        }

        @Test
        void undecodableEntriesAreSkippedWithoutBeingMarkedFailed() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(
                    List.of("u@e.com----pw", "a----b----c----d", "tokC"));

            assertThat(pool.acquire()).contains("tokC");
            assertThat(pool.acquire()).contains("tokC");
            assertThat(pool.failedCount()).isZero();
        }

        @Test
        void poolOfOnlyUndecodableEntriesYieldsNothing() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("u@e.com----pw", "x----y----z----w"));

            assertThat(pool.acquire()).isEmpty();
        }

        @Test
        void bareAndCompositeScenario() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "u@e.com----pw----tokB"));

            pool.markFailed("tokA");
            assertThat(pool.acquire()).contains("tokB");

            pool.markFailed("tokB");
            assertThat(pool.acquire()).contains("tokA");
            assertThat(pool.failedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("failure reporting")
    class FailureReporting {

        @Test
        void derivedTokenMarksTheCompositeEntryInPoolForm() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("u@e.com----pw----tokB"));

            pool.markFailed("tokB");

            assertThat(pool.failedEntries()).containsExactly("u@e.com----pw----tokB");
        }

        @Test
        void unknownTokenIsIgnored() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA"));

            pool.markFailed("not-in-pool");
            pool.markSuccess("not-in-pool");

            assertThat(pool.failedCount()).isZero();
        }

        @Test
        void markingTwiceKeepsOneFailure() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokB"));

            pool.markFailed("tokA");
            pool.markFailed("tokA");

            assertThat(pool.failedCount()).isEqualTo(1);
        }

        @Test
        void countersStayWithinPoolBoundsWhileOtherThreadsMutate() throws Exception {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokB", "tokC"));
            AtomicBoolean stop = new AtomicBoolean();
            Thread writer = new Thread(() -> {
                while (!stop.get()) {
                    pool.markFailed("tokA");
                    pool.markFailed("tokB");
                    pool.replaceAll(List.of("tokA", "tokB", "tokC"));
                }
            });
            writer.start();
            try {
                for (int i = 0; i < 10_000; i++) {
                    assertThat(pool.size()).isEqualTo(3);
                    assertThat(pool.failedCount()).isBetween(0, 2);
                }
            } finally {
                stop.set(true);
                writer.join();
            }
        }
    }

    @Nested
    @DisplayName("replacement and eviction")
    class ReplacementAndEviction {

        @Test
        void replacementKeepsPositionAndOtherEntries() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(
                    List.of("tokA", "u@e.com----pw----old", "tokC"));
            pool.markFailed("old");

            boolean replaced = pool.replace(new PoolReplacement(-1, "u@e.com----pw----old",
                    CredentialEntry.composite("u@e.com", "pw", "new")));

            assertThat(replaced).isTrue();
            assertThat(pool.snapshot().getEntries())
                    .containsExactly("tokA", "u@e.com----pw----new", "tokC");
            assertThat(pool.failedCount()).isZero();
            assertThat(pool.resolve("new")).map(CredentialEntry::getRaw).contains("u@e.com----pw----new");
            assertThat(pool.resolve("u@e.com----pw----old")).isEmpty();
            assertThat(pool.resolve("old")).isEmpty();
        }

        @Test
        void refreshedTokenStillResolvesToRemainingBareDuplicate() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("u@e.com----pw----tokB", "tokB"));

            pool.replace(new PoolReplacement(0, "u@e.com----pw----tokB",
                    CredentialEntry.composite("u@e.com", "pw", "tokC")));

            assertThat(pool.resolve("tokB")).map(CredentialEntry::getRaw).contains("tokB");
            assertThat(pool.resolve("tokC")).map(CredentialEntry::getRaw).contains("u@e.com----pw----tokC");
            assertThat(pool.resolve("u@e.com----pw----tokB")).isEmpty();

            pool.markFailed("tokB");
            assertThat(pool.failedEntries()).containsExactly("tokB");
        }

        @Test
        void replacementOfVanishedEntryLeavesPoolUntouched() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA"));

            boolean replaced = pool.replace(new PoolReplacement(0, "u@e.com----pw----gone",
                    CredentialEntry.composite("u@e.com", "pw", "new")));

            assertThat(replaced).isFalse();
            assertThat(pool.snapshot().getEntries()).containsExactly("tokA");
        }

        @Test
        void batchReplacementFallsBackToRawLookupWhenPositionsShifted() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(
                    List.of("tokA", "a@e.com----pw----t1", "b@e.com----pw----t2"));
            pool.evict(List.of("tokA"));

            List<PoolReplacement> applied = pool.replaceBatch(List.of(
                    new PoolReplacement(2, "b@e.com----pw----t2", CredentialEntry.composite("b@e.com", "pw", "t2b")),
                    new PoolReplacement(1, "gone----pw----t9", CredentialEntry.composite("gone", "pw", "t9b"))));

            assertThat(applied).hasSize(1);
            assertThat(pool.snapshot().getEntries()).containsExactly("a@e.com----pw----t1", "b@e.com----pw----t2b");
        }

        @Test
        void evictionRemovesEntryFromPoolFailuresAndEveryAlias() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(
                    List.of("tokA", "u@e.com----pw----tokB", "tokC"));
            pool.markFailed("tokB");

            int removed = pool.evict(List.of("u@e.com----pw----tokB"));

            assertThat(removed).isEqualTo(1);
            PoolSnapshot snapshot = pool.snapshot();
            assertThat(snapshot.getEntries()).containsExactly("tokA", "tokC");
            assertThat(snapshot.getFailedEntries()).isEmpty();
            assertThat(pool.resolve("tokB")).isEmpty();
            assertThat(pool.resolve("u@e.com----pw----tokB")).isEmpty();

            pool.markFailed("tokB");
            assertThat(pool.failedCount()).isZero();
        }

        @Test
        void evictionAfterRefreshLeavesNoStaleAliasResolvable() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("u@e.com----pw----old", "tokC"));
            pool.replace(new PoolReplacement(0, "u@e.com----pw----old", CredentialEntry.composite("u@e.com", "pw", "new")));

            pool.evict(List.of("u@e.com----pw----new"));

            assertThat(pool.resolve("old")).isEmpty();
            assertThat(pool.resolve("new")).isEmpty();
            assertThat(pool.resolve("u@e.com----pw----new")).isEmpty();
            assertThat(pool.resolve("tokC")).isPresent();
        }

        @Test
        void evictionKeepsRotationMovingForward() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokB", "tokC", "tokD"));
            pool.acquire();
            pool.acquire();

            pool.evict(List.of("tokA"));

            assertThat(pool.acquire()).contains("tokC");
            assertThat(pool.acquire()).contains("tokD");
            assertThat(pool.acquire()).contains("tokB");
        }

        @Test
        void replaceAllResetsFailuresAndCursor() {
            InMemoryCredentialPool pool = new InMemoryCredentialPool(List.of("tokA", "tokB"));
            pool.acquire();
            pool.markFailed("tokB");

            pool.replaceAll(List.of(" tokX ", "", "tokY"));

            assertThat(pool.snapshot().getEntries()).containsExactly("tokX", "tokY");
            assertThat(pool.failedEntries()).isEqualTo(Set.of());
            assertThat(pool.acquire()).contains("tokX");
        }
    }
}
