package com.example.mafiaparty.room.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 호스트 연결이 끊긴 방의 유예 타이머. 방마다 최대 하나만 예약된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HostGraceTimerService {

    private final TaskScheduler taskScheduler;

    // 방 코드 -> 예약된 방 종료 작업
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    public void schedule(String roomCode, Duration delay, Runnable task) {
        cancel(roomCode);

        Instant executionTime = Instant.now().plus(delay);
        ScheduledFuture<?> future = taskScheduler.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("호스트 유예 타이머 실행 중 오류: room={}", roomCode, e);
            } finally {
                scheduledTasks.remove(roomCode);
            }
        }, executionTime);

        scheduledTasks.put(roomCode, future);
        log.info("호스트 유예 타이머 예약: room={}, until={}", roomCode, executionTime);
    }

    /**
     * @return 예약된 작업이 있어서 취소했으면 true
     */
    public boolean cancel(String roomCode) {
        ScheduledFuture<?> future = scheduledTasks.remove(roomCode);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.info("호스트 유예 타이머 취소: room={}", roomCode);
        return true;
    }

    public boolean isScheduled(String roomCode) {
        return scheduledTasks.containsKey(roomCode);
    }
}
