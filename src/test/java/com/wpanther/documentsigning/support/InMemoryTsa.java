package com.wpanther.documentsigning.support;

import java.math.BigInteger;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.service.TimeStampAuthorityService;
import com.wpanther.documentsigning.service.TsaSerialAllocator;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Time-stamping authority wired without a database: serials come from a counter.
 */
public final class InMemoryTsa {

    private InMemoryTsa() {
    }

    public static TimeStampAuthorityService create(TrustMaterial trustMaterial, long timeoutSeconds) {
        AtomicLong counter = new AtomicLong();
        TsaSerialAllocator allocator = mock(TsaSerialAllocator.class);
        when(allocator.allocate(anyString(), anyString()))
                .thenAnswer(invocation -> BigInteger.valueOf(counter.incrementAndGet()));
        return create(trustMaterial, allocator, timeoutSeconds);
    }

    public static TimeStampAuthorityService create(TrustMaterial trustMaterial, TsaSerialAllocator allocator,
            long timeoutSeconds) {
        TimeStampAuthorityService service = new TimeStampAuthorityService(trustMaterial, allocator, executor(),
                Clock.systemUTC());
        ReflectionTestUtils.setField(service, "timeoutSeconds", timeoutSeconds);
        ReflectionTestUtils.setField(service, "policyOid", "1.2.3.4.1");
        return service;
    }

    private static ThreadPoolTaskExecutor executor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("test-tsa-");
        executor.initialize();
        return executor;
    }
}
