package com.hashkit.service;

import com.hashkit.codec.LengthPrefixedCodec;
import com.hashkit.config.AppConfig;
import com.hashkit.service.counting.BucketTopKService;
import com.hashkit.service.counting.CountKeyGroupingService;
import com.hashkit.service.counting.HashFrequencyService;
import com.hashkit.service.sorting.HeapTopKService;
import com.hashkit.service.sorting.SortedKeyGroupingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Factory for creating algorithm services based on configuration.
 */
public class ServiceFactory {

    private static final Logger logger = LoggerFactory.getLogger(ServiceFactory.class);

    private ServiceFactory() {
    }

    /**
     * Create frequency service.
     */
    public static FrequencyService createFrequencyService(AppConfig config) {
        return new HashFrequencyService();
    }

    /**
     * Create top-K service based on {@code hashkit.top-k.strategy}.
     */
    public static TopKService createTopKService(AppConfig config) {
        FrequencyService frequencyService = createFrequencyService(config);
        String strategy = config.getTopKStrategy().toLowerCase(Locale.ROOT);

        switch (strategy) {
            case "heap":
                logger.info("Using heap top-K service");
                return new HeapTopKService(frequencyService);
            case "bucket":
                logger.info("Using bucket top-K service");
                return new BucketTopKService(frequencyService);
            default:
                logger.warn("Unknown top-K strategy '{}', using bucket", strategy);
                return new BucketTopKService(frequencyService);
        }
    }

    /**
     * Create grouping service based on {@code hashkit.grouping.key}.
     */
    public static GroupingService createGroupingService(AppConfig config) {
        String key = config.getGroupingKey().toLowerCase(Locale.ROOT);

        switch (key) {
            case "count":
                logger.info("Using count-key grouping service");
                return new CountKeyGroupingService();
            case "sorted":
                logger.info("Using sorted-key grouping service");
                return new SortedKeyGroupingService();
            default:
                logger.warn("Unknown grouping key '{}', using sorted", key);
                return new SortedKeyGroupingService();
        }
    }

    /**
     * Create codec with the configured delimiter.
     */
    public static LengthPrefixedCodec createCodec(AppConfig config) {
        return new LengthPrefixedCodec(config.getCodecDelimiter());
    }

    /**
     * All top-K implementations, for benchmarking.
     */
    public static List<TopKService> allTopKServices() {
        return List.of(new BucketTopKService(), new HeapTopKService());
    }

    /**
     * All grouping implementations, for benchmarking.
     */
    public static List<GroupingService> allGroupingServices() {
        return List.of(new SortedKeyGroupingService(), new CountKeyGroupingService());
    }
}
