package com.acme.enginesync.watcher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResponseRegistry Unit Tests")
class ResponseRegistryTest {

    private ResponseRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ResponseRegistry();
    }

    @Nested
    @DisplayName("Registration Tests")
    class RegistrationTests {

        @Test
        @DisplayName("Should register pending wait under its request id")
        void testRegister() {
            PendingResponse pending = new PendingResponse("req-1");

            registry.register("req-1", pending);

            assertThat(registry.contains("req-1")).isTrue();
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should let the last registration win and mark the previous one displaced")
        void testRegister_Overwrite() {
            PendingResponse first = new PendingResponse("req-1");
            PendingResponse second = new PendingResponse("req-1");

            registry.register("req-1", first);
            registry.register("req-1", second);

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.takeAndClear("req-1")).containsSame(second);
            assertThat(first.isDisplaced()).isTrue();
            assertThat(second.isDisplaced()).isFalse();
        }
    }

    @Nested
    @DisplayName("Take-and-Clear Tests")
    class TakeAndClearTests {

        @Test
        @DisplayName("Should return and remove the registered wait")
        void testTakeAndClear() {
            PendingResponse pending = new PendingResponse("req-1");
            registry.register("req-1", pending);

            Optional<PendingResponse> taken = registry.takeAndClear("req-1");

            assertThat(taken).containsSame(pending);
            assertThat(registry.contains("req-1")).isFalse();
            assertThat(registry.takeAndClear("req-1")).isEmpty();
        }

        @Test
        @DisplayName("Should report not found for unknown ids")
        void testTakeAndClear_Unknown() {
            assertThat(registry.takeAndClear("missing")).isEmpty();
        }

        @Test
        @DisplayName("Should only remove the expected wait")
        void testTakeAndClear_Expected() {
            PendingResponse stale = new PendingResponse("req-1");
            PendingResponse current = new PendingResponse("req-1");
            registry.register("req-1", stale);
            registry.register("req-1", current);

            assertThat(registry.takeAndClear("req-1", stale)).isFalse();
            assertThat(registry.contains("req-1")).isTrue();
            assertThat(registry.takeAndClear("req-1", current)).isTrue();
            assertThat(registry.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should let exactly one of many concurrent claimers win")
        void testConcurrentClaim_SingleWinner() throws Exception {
            int rounds = 200;
            int claimers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(claimers);
            try {
                for (int round = 0; round < rounds; round++) {
                    String id = "req-" + round;
                    PendingResponse pending = new PendingResponse(id);
                    registry.register(id, pending);

                    CountDownLatch start = new CountDownLatch(1);
                    List<Future<Boolean>> results = new ArrayList<>();
                    for (int i = 0; i < claimers; i++) {
                        boolean conditional = i % 2 == 0;
                        results.add(pool.submit(() -> {
                            start.await();
                            return conditional
                                    ? registry.takeAndClear(id, pending)
                                    : registry.takeAndClear(id).isPresent();
                        }));
                    }
                    start.countDown();

                    int winners = 0;
                    for (Future<Boolean> result : results) {
                        if (result.get(5, TimeUnit.SECONDS)) {
                            winners++;
                        }
                    }
                    assertThat(winners).as("winners in round %d", round).isEqualTo(1);
                }
                assertThat(registry.size()).isZero();
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should let an expiring wait see its entry or the displaced flag when replaced concurrently")
        void testReplaceDuringExpiry_NeverLost() throws Exception {
            int rounds = 500;
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < rounds; round++) {
                    String id = "req-" + round;
                    PendingResponse first = new PendingResponse(id);
                    PendingResponse second = new PendingResponse(id);
                    registry.register(id, first);

                    CountDownLatch start = new CountDownLatch(1);
                    Future<?> replace = pool.submit(() -> {
                        start.await();
                        registry.register(id, second);
                        return null;
                    });
                    Future<Boolean> expiry = pool.submit(() -> {
                        start.await();
                        return registry.takeAndClear(id, first) || first.isDisplaced();
                    });
                    start.countDown();

                    replace.get(5, TimeUnit.SECONDS);
                    assertThat(expiry.get(5, TimeUnit.SECONDS))
                            .as("first wait reachable in round %d", round)
                            .isTrue();
                    registry.takeAndClear(id);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
