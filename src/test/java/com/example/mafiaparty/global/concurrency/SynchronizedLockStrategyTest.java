package com.example.mafiaparty.global.concurrency;

import com.example.mafiaparty.global.concurrency.strategy.SynchronizedLockStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 같은 방 키로 들어온 작업이 서로 끼어들지 않는지 확인
 */
class SynchronizedLockStrategyTest {

    private static final int THREAD_COUNT = 32;
    private static final int ITERATIONS_PER_THREAD = 200;

    private final LockStrategy lockStrategy = new SynchronizedLockStrategy();
    private int counter;

    @Test
    @DisplayName("같은 키의 작업은 하나씩 실행되어 갱신이 사라지지 않는다")
    void sameKeyIsSerialized() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch latch = new CountDownLatch(THREAD_COUNT);

        for (int i = 0; i < THREAD_COUNT; i++) {
            executor.submit(() -> {
                try {
                    for (int j = 0; j < ITERATIONS_PER_THREAD; j++) {
                        lockStrategy.executeWithLock("room:ABCD", () -> {
                            int current = counter;
                            Thread.yield();
                            counter = current + 1;
                        });
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(counter).isEqualTo(THREAD_COUNT * ITERATIONS_PER_THREAD);
    }

    @Test
    @DisplayName("결과값이 있는 작업은 그대로 돌려준다")
    void returnsActionResult() {
        String result = lockStrategy.executeWithLock("room:WXYZ", () -> "done");

        assertThat(result).isEqualTo("done");
    }
}
