package com.example.mafiaparty.global.concurrency;

import java.util.function.Supplier;

/**
 * 룸 단위 직렬화를 위한 락 전략.
 * 같은 lockKey 로 들어온 작업은 한 번에 하나씩만 실행되고, 다른 키끼리는 서로 막지 않는다.
 */
public interface LockStrategy {

    /**
     * 락을 획득하고 비즈니스 로직을 실행
     *
     * @param lockKey 락을 식별하는 키 (예: "room:ABCD")
     * @param action  락 보호 하에 실행할 로직
     * @return 로직 실행 결과
     */
    <T> T executeWithLock(String lockKey, Supplier<T> action);

    /**
     * 반환값 없는 로직용 오버로드
     */
    default void executeWithLock(String lockKey, Runnable action) {
        executeWithLock(lockKey, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 더 이상 쓰지 않는 키의 락 객체를 정리한다.
     */
    void release(String lockKey);
}
