package io.formflow.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formflow.core.event.Event;
import io.formflow.core.event.EventKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BarrierTest {

    enum Kinds implements EventKind {
        RESPONSE,
        SUMMARY,
        OTHER
    }

    private Barrier barrier;

    @BeforeEach
    void setUp() {
        barrier = new Barrier();
    }

    private static Event response(int n) {
        return Event.of(Kinds.RESPONSE, Map.of("n", n));
    }

    @Nested
    class Release {

        @Test
        void shouldStayIncompleteUntilCountReached() {
            RequiredKinds required = RequiredKinds.of(Kinds.RESPONSE, 3);

            CollectResult first = barrier.collect("fill", response(1), required);
            CollectResult second = barrier.collect("fill", response(2), required);

            assertThat(first).isInstanceOf(CollectResult.Incomplete.class);
            assertThat(second).isInstanceOf(CollectResult.Incomplete.class);
            assertThat(barrier.buffered("fill")).isEqualTo(2);
        }

        @Test
        void shouldReleaseExactlyRequiredEventsInArrivalOrder() {
            RequiredKinds required = RequiredKinds.of(Kinds.RESPONSE, 3);
            barrier.collect("fill", response(1), required);
            barrier.collect("fill", response(2), required);

            CollectResult third = barrier.collect("fill", response(3), required);

            assertThat(third).isInstanceOf(CollectResult.Batch.class);
            List<Event> batch = ((CollectResult.Batch) third).events();
            assertThat(batch).extracting(e -> e.get("n", Integer.class)).containsExactly(1, 2, 3);
            assertThat(barrier.buffered("fill")).isZero();
        }

        @Test
        void shouldReleaseOneBatchPerCompletedRound() {
            RequiredKinds required = RequiredKinds.of(Kinds.RESPONSE, 2);
            List<CollectResult> results = new ArrayList<>();

            for (int i = 1; i <= 4; i++) {
                results.add(barrier.collect("fill", response(i), required));
            }

            assertThat(results).filteredOn(CollectResult::isBatch).hasSize(2);
            assertThat(((CollectResult.Batch) results.get(3)).events())
                    .extracting(e -> e.get("n", Integer.class))
                    .containsExactly(3, 4);
        }

        @Test
        void shouldGroupMixedKindsByDeclarationOrder() {
            RequiredKinds required = RequiredKinds.of(Kinds.SUMMARY, 1).and(Kinds.RESPONSE, 2);
            barrier.collect("join", response(1), required);
            barrier.collect("join", Event.of(Kinds.OTHER), required);
            barrier.collect("join", response(2), required);

            CollectResult result = barrier.collect("join", Event.of(Kinds.SUMMARY), required);

            assertThat(((CollectResult.Batch) result).events())
                    .extracting(Event::kind)
                    .containsExactly(Kinds.SUMMARY, Kinds.RESPONSE, Kinds.RESPONSE);
            assertThat(barrier.buffered("join")).isEqualTo(1);
        }

        @Test
        void shouldBufferWhileCountPending() {
            barrier.collect("fill", response(1), RequiredKinds.pending());

            CollectResult result =
                    barrier.collect("fill", response(2), RequiredKinds.of(Kinds.RESPONSE, 2));

            assertThat(result.isBatch()).isTrue();
        }

        @Test
        void shouldKeepBuffersOfStepsApart() {
            RequiredKinds required = RequiredKinds.of(Kinds.RESPONSE, 2);
            barrier.collect("left", response(1), required);

            CollectResult result = barrier.collect("right", response(2), required);

            assertThat(result).isInstanceOf(CollectResult.Incomplete.class);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldReleaseSingleBatchUnderConcurrentArrivals() throws Exception {
            int arrivals = 50;
            RequiredKinds required = RequiredKinds.of(Kinds.RESPONSE, arrivals);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch go = new CountDownLatch(1);
            try {
                List<Future<CollectResult>> futures = new ArrayList<>();
                for (int i = 0; i < arrivals; i++) {
                    int n = i;
                    futures.add(
                            pool.submit(
                                    () -> {
                                        go.await();
                                        return barrier.collect("fill", response(n), required);
                                    }));
                }
                go.countDown();

                int batches = 0;
                for (Future<CollectResult> future : futures) {
                    if (future.get(5, TimeUnit.SECONDS).isBatch()) {
                        batches++;
                    }
                }
                assertThat(batches).isEqualTo(1);
                assertThat(barrier.buffered("fill")).isZero();
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void shouldRejectCollectAfterRelease() {
        barrier.collect("fill", response(1), RequiredKinds.of(Kinds.RESPONSE, 2));

        barrier.release();

        assertThat(barrier.buffered("fill")).isZero();
        assertThatThrownBy(
                        () ->
                                barrier.collect(
                                        "fill", response(2), RequiredKinds.of(Kinds.RESPONSE, 2)))
                .isInstanceOf(IllegalStateException.class);
    }
}
