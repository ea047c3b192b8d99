package com.example.mafiaparty.global.concurrency.strategy;

import com.example.mafiaparty.global.concurrency.LockStrategy;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Java synchronized 기반 락 전략.
 * 룸 상태는 단일 JVM 메모리에만 있으므로 프로세스 내부 락으로 충분하다.
 */
@Component
public class SynchronizedLockStrategy implements LockStrategy {

    // lockKey별로 별도의 락 객체를 관리 (같은 키에 대해서만 동기화)
    private final Map<String, Object> lockMap = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        Object lock = lockMap.computeIfAbsent(lockKey, k -> new Object());

        synchronized (lock) {
            return action.get();
        }
    }

    @Override
    public void release(String lockKey) {
        lockMap.remove(lockKey);
    }
}
