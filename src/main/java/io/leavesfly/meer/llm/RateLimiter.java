package io.leavesfly.meer.llm;

import io.leavesfly.meer.config.LLMProviderConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * LLM 请求限流器
 * 滑动窗口：窗口内请求数达到上限时休眠 sleepMs 后再放行
 * <p>
 * 线程安全；多个子代理共享同一提供商时共享同一个限流器
 */
@Slf4j
public class RateLimiter {

    private final long windowMs;
    private final int maxRequests;
    private final long sleepMs;

    /**
     * 窗口内的请求时间戳，队头最旧
     */
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public RateLimiter(LLMProviderConfig.RateLimitConfig config) {
        this.windowMs = config.getWindowMs();
        this.maxRequests = config.getMaxRequests();
        this.sleepMs = config.getSleepMs();
        log.info("RateLimiter initialized: {}ms window, {} max requests, {}ms sleep",
                windowMs, maxRequests, sleepMs);
    }

    /**
     * 发送请求前调用，超限时阻塞当前线程
     */
    public synchronized void acquirePermit() {
        long now = System.currentTimeMillis();
        evictExpired(now);

        if (timestamps.size() >= maxRequests) {
            log.debug("Rate limit reached ({} requests in {}ms), sleeping {}ms", maxRequests, windowMs, sleepMs);
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Rate limiter sleep interrupted", e);
            }
            now = System.currentTimeMillis();
            evictExpired(now);
        }

        timestamps.addLast(now);
    }

    /**
     * 非阻塞形式，在 boundedElastic 上等待许可
     */
    public Mono<Void> acquire() {
        return Mono.fromRunnable(this::acquirePermit)
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    public synchronized int getCurrentRequestCount() {
        evictExpired(System.currentTimeMillis());
        return timestamps.size();
    }

    public synchronized void reset() {
        timestamps.clear();
        log.debug("RateLimiter reset");
    }

    private void evictExpired(long now) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowMs) {
            timestamps.pollFirst();
        }
    }
}
