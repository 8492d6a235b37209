package com.hashkit.benchmark;

/**
 * Result of a benchmark run.
 */
public class BenchmarkResult {

    private final String benchmarkName;
    private final String serviceName;
    private final int inputSize;
    private final int outputSize;
    private final long totalDuration;
    private final int iterations;

    private BenchmarkResult(Builder builder) {
        this.benchmarkName = builder.benchmarkName;
        this.serviceName = builder.serviceName;
        this.inputSize = builder.inputSize;
        this.outputSize = builder.outputSize;
        this.totalDuration = builder.totalDuration;
        this.iterations = builder.iterations;
    }

    public String getBenchmarkName() { return benchmarkName; }
    public String getServiceName() { return serviceName; }
    public int getInputSize() { return inputSize; }
    public int getOutputSize() { return outputSize; }
    public long getTotalDuration() { return totalDuration; }
    public int getIterations() { return iterations; }

    /**
     * Input items processed per second.
     */
    public double getItemsPerSecond() {
        if (totalDuration == 0) return 0;
        return inputSize / (totalDuration / 1_000_000_000.0);
    }

    public double getDurationMillis() {
        return totalDuration / 1_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("%s [%s]: %.0f items/s, %d results, %.3f ms avg",
            benchmarkName, serviceName, getItemsPerSecond(), outputSize, getDurationMillis());
    }

    public static class Builder {
        private String benchmarkName;
        private String serviceName;
        private int inputSize;
        private int outputSize;
        private long totalDuration;
        private int iterations = 1;

        public Builder benchmarkName(String name) {
            this.benchmarkName = name;
            return this;
        }

        public Builder serviceName(String name) {
            this.serviceName = name;
            return this;
        }

        public Builder inputSize(int size) {
            this.inputSize = size;
            return this;
        }

        public Builder outputSize(int size) {
            this.outputSize = size;
            return this;
        }

        public Builder totalDuration(long nanos) {
            this.totalDuration = nanos;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public BenchmarkResult build() {
            return new BenchmarkResult(this);
        }
    }
}
