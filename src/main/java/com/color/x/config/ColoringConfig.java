package com.color.x.config;

import com.color.x.metrics.ColoringMetrics;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class ColoringConfig {

    @Bean
    public ProbabilisticSearchConfig probabilisticSearchConfig(
            @Value("${coloring.probabilistic.trials:10}") int trials,
            @Value("${coloring.probabilistic.reweight-increment:0.1}") double reweightIncrement,
            @Value("${coloring.probabilistic.local-search.max-iterations:50}") int localSearchIterations,
            @Value("${coloring.probabilistic.local-search.perturbation-fraction:0.2}") double perturbationFraction,
            @Value("${coloring.probabilistic.seed:#{null}}") Long seed) {
        return ProbabilisticSearchConfig.builder()
                .trials(trials)
                .reweightIncrement(reweightIncrement)
                .localSearchIterations(localSearchIterations)
                .perturbationFraction(perturbationFraction)
                .seed(seed)
                .build();
    }

    @Bean(name = "coloringExecutor", destroyMethod = "shutdownNow")
    public ExecutorService coloringExecutor(@Value("${coloring.workers:8}") int workers, ColoringMetrics metrics) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("coloring-worker-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> log.error("Coloring worker {} failed", t.getName(), e))
                .build();

        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        metrics.incrementRejections();
                        log.warn("Coloring task rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
        executor.allowCoreThreadTimeOut(false);
        return executor;
    }
}
