package com.hashkit.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Application configuration wrapper.
 */
public class AppConfig {

    private final Config config;

    public AppConfig() {
        this(ConfigFactory.load());
    }

    public AppConfig(Config config) {
        this.config = config.getConfig("hashkit");
    }

    // Algorithm settings
    public String getTopKStrategy() {
        return config.getString("top-k.strategy");
    }

    public String getGroupingKey() {
        return config.getString("grouping.key");
    }

    public char getCodecDelimiter() {
        String delimiter = config.getString("codec.delimiter");
        if (delimiter.length() != 1) {
            throw new ConfigException.BadValue(config.origin(), "codec.delimiter",
                "must be a single character, got \"" + delimiter + "\"");
        }
        return delimiter.charAt(0);
    }

    // Benchmark settings
    public int getWarmupIterations() {
        return config.getInt("benchmark.warmup-iterations");
    }

    public int getMeasurementIterations() {
        return config.getInt("benchmark.measurement-iterations");
    }

    public int getBenchmarkSampleSize() {
        return config.getInt("benchmark.sample-size");
    }

    public long getBenchmarkSeed() {
        return config.getLong("benchmark.seed");
    }
}
