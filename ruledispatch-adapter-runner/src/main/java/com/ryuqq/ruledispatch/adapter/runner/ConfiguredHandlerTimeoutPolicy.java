package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.protection.HandlerTimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * {@link TimeoutConfig} 기반 Handler Timeout Policy.
 *
 * <p>태그별 타임아웃을 설정에서 읽고, 발생한 타임아웃 횟수를 태그별로 집계합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class ConfiguredHandlerTimeoutPolicy implements HandlerTimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredHandlerTimeoutPolicy.class);

    private final TimeoutConfig config;
    private final Map<ParameterTypeTag, LongAdder> timeoutCounts = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param config 타임아웃 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ConfiguredHandlerTimeoutPolicy(TimeoutConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public long getTimeoutMs(ParameterTypeTag tag) {
        return config.timeoutFor(tag);
    }

    @Override
    public void recordTimeout(ParameterTypeTag tag, long elapsedMs) {
        timeoutCounts.computeIfAbsent(tag, key -> new LongAdder()).increment();
        log.debug("Handler timeout for {} after {}ms (limit: {}ms)", tag.getValue(), elapsedMs, config.timeoutFor(tag));
    }

    /**
     * 태그별 타임아웃 발생 횟수.
     *
     * @param tag 파라미터 태그
     * @return 누적 횟수
     */
    public long timeoutCount(ParameterTypeTag tag) {
        LongAdder counter = timeoutCounts.get(tag);
        return counter == null ? 0 : counter.sum();
    }
}
