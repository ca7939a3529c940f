package com.lntracker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.SynchronousQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.TRACKER_EXECUTOR)
    Executor trackerExecutor;

    @Test
    @DisplayName("reconciliation exists cache is created and usable")
    void cacheCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.RECONCILIATION_EXISTS_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.RECONCILIATION_EXISTS_CACHE).put("PAYMENTS:02node:1", Boolean.TRUE);
        assertThat(cacheManager.getCache(CaffeineConfig.RECONCILIATION_EXISTS_CACHE).get("PAYMENTS:02node:1").get())
                .isEqualTo(Boolean.TRUE);
    }

    @Test
    @DisplayName("tracker executor holds a thread per long-running loop")
    void trackerExecutorCreated() {
        assertThat(trackerExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) trackerExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(AsyncConfig.TRACKER_POOL_SIZE);
        assertThat(executor.getMaxPoolSize()).isEqualTo(AsyncConfig.TRACKER_POOL_SIZE);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("tracker-");
        assertThat(executor.getThreadPoolExecutor().getQueue()).isInstanceOf(SynchronousQueue.class);
    }

    @Test
    @DisplayName("a task beyond the pool size is rejected instead of queued")
    void trackerExecutor_full_rejectsExtraTask() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) trackerExecutor;
        CountDownLatch release = new CountDownLatch(1);
        try {
            for (int i = 0; i < AsyncConfig.TRACKER_POOL_SIZE; i++) {
                executor.execute(() -> {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
        }
    }
}
