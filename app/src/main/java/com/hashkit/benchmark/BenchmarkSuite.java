package com.hashkit.benchmark;

import com.hashkit.config.AppConfig;
import com.hashkit.service.GroupingService;
import com.hashkit.service.ServiceFactory;
import com.hashkit.service.TopKService;
import com.hashkit.util.SampleDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Benchmark suite comparing the top-K and grouping strategies.
 */
public class BenchmarkSuite {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkSuite.class);
    private static final int TOP_K = 10;

    private final int warmupIterations;
    private final int measurementIterations;
    private final int sampleSize;
    private final long seed;

    public BenchmarkSuite(AppConfig config) {
        this.warmupIterations = config.getWarmupIterations();
        this.measurementIterations = config.getMeasurementIterations();
        this.sampleSize = config.getBenchmarkSampleSize();
        this.seed = config.getBenchmarkSeed();

        if (measurementIterations <= 0) {
            throw new IllegalArgumentException("measurement-iterations must be positive");
        }
    }

    /**
     * Run every top-K and grouping implementation over the same sample data.
     */
    public BenchmarkComparison runFullSuite() {
        logger.info("Starting benchmark suite with {} samples (seed {})", sampleSize, seed);

        List<BenchmarkResult> results = new ArrayList<>();

        int[] numbers = SampleDataGenerator.skewedIntegers(sampleSize, Math.max(1, sampleSize / 10), seed);
        for (TopKService service : ServiceFactory.allTopKServices()) {
            results.add(benchmarkTopK(service, numbers));
        }

        List<String> words = SampleDataGenerator.anagramWords(sampleSize, seed);
        for (GroupingService service : ServiceFactory.allGroupingServices()) {
            results.add(benchmarkGrouping(service, words));
        }

        return new BenchmarkComparison(results);
    }

    /**
     * Benchmark a top-K implementation.
     */
    public BenchmarkResult benchmarkTopK(TopKService service, int[] numbers) {
        return measure("top-k", service.getServiceName(), numbers.length,
            () -> service.topKFrequent(numbers, TOP_K).size());
    }

    /**
     * Benchmark a grouping implementation.
     */
    public BenchmarkResult benchmarkGrouping(GroupingService service, List<String> words) {
        return measure("grouping", service.getServiceName(), words.size(),
            () -> service.group(words).size());
    }

    private BenchmarkResult measure(String benchmarkName, String serviceName,
                                    int inputSize, Supplier<Integer> operation) {
        logger.info("Benchmarking {}: {}", benchmarkName, serviceName);

        for (int i = 0; i < warmupIterations; i++) {
            logger.debug("Warmup iteration {}/{}", i + 1, warmupIterations);
            operation.get();
        }

        long totalDuration = 0;
        int outputSize = 0;
        for (int i = 0; i < measurementIterations; i++) {
            logger.debug("Measurement iteration {}/{}", i + 1, measurementIterations);

            long startTime = System.nanoTime();
            outputSize = operation.get();
            totalDuration += System.nanoTime() - startTime;
        }

        BenchmarkResult result = new BenchmarkResult.Builder()
            .benchmarkName(benchmarkName)
            .serviceName(serviceName)
            .inputSize(inputSize)
            .outputSize(outputSize)
            .totalDuration(totalDuration / measurementIterations)
            .iterations(measurementIterations)
            .build();

        logger.info("Benchmark complete: {}", result);
        return result;
    }

    /**
     * Comparison of benchmark results.
     */
    public static class BenchmarkComparison {
        private final List<BenchmarkResult> results;

        public BenchmarkComparison(List<BenchmarkResult> results) {
            this.results = new ArrayList<>(results);
        }

        public List<BenchmarkResult> getResults() {
            return new ArrayList<>(results);
        }

        /**
         * Fastest implementation for one benchmark, or null if it was not run.
         */
        public BenchmarkResult getFastest(String benchmarkName) {
            return results.stream()
                .filter(r -> r.getBenchmarkName().equals(benchmarkName))
                .max(Comparator.comparingDouble(BenchmarkResult::getItemsPerSecond))
                .orElse(null);
        }

        public String getSummary() {
            StringBuilder sb = new StringBuilder();
            sb.append("Benchmark Results:\n");
            for (BenchmarkResult result : results) {
                sb.append("  ").append(result).append('\n');
            }
            return sb.toString();
        }
    }
}
