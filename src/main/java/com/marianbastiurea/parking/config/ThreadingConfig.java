package com.marianbastiurea.parking.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration(proxyBeanMethods = false)
public class ThreadingConfig {

    private static final Logger log = LoggerFactory.getLogger(ThreadingConfig.class);

    @Bean("scoringThreadFactory")
    public ThreadFactory scoringThreadFactory(
            @Value("${threads.scoring.name-prefix:scoring-}") String namePrefix
    ) {
        log.info("Creating scoring thread factory (prefix='{}', JDK={}).", namePrefix, Runtime.version());
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, namePrefix + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    @Bean(name = "scoringExecutor", destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(
            @Qualifier("scoringThreadFactory") ThreadFactory factory,
            @Value("${threads.scoring.pool-size:4}") int poolSize
    ) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("threads.scoring.pool-size must be >= 1, got " + poolSize);
        }
        log.info("Scoring executor created with {} thread(s).", poolSize);
        return Executors.newFixedThreadPool(poolSize, factory);
    }
}
