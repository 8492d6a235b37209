package com.hashkit.cli;

import com.hashkit.benchmark.BenchmarkSuite;
import com.hashkit.codec.LengthPrefixedCodec;
import com.hashkit.codec.MalformedEncodingException;
import com.hashkit.config.AppConfig;
import com.hashkit.core.AnagramChecker;
import com.hashkit.core.ConsecutiveRun;
import com.hashkit.core.ConsecutiveRuns;
import com.hashkit.core.DuplicateDetector;
import com.hashkit.core.PairSumFinder;
import com.hashkit.core.ProductExceptSelf;
import com.hashkit.service.GroupingService;
import com.hashkit.service.ServiceFactory;
import com.hashkit.service.TopKService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line interface for the HashKit algorithms.
 *
 * Usage:
 *   java -jar hashkit.jar two-sum 7 3 4 5 6
 *   java -jar hashkit.jar encode words.txt words.enc
 */
public class HashKitCLI {

    private static final Logger logger = LoggerFactory.getLogger(HashKitCLI.class);

    private final AppConfig config;
    private final PrintStream out;

    public HashKitCLI(AppConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new HashKitCLI(new AppConfig(), System.out).run(args);
        } catch (IOException e) {
            logger.error("Operation failed", e);
            System.err.println("Error: " + e.getMessage());
            exitCode = 1;
        } catch (Exception e) {
            logger.error("Unexpected error", e);
            System.err.println("Unexpected error: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Execute one command.
     *
     * @return Process exit code
     */
    public int run(String[] args) throws IOException {
        if (args.length < 1) {
            printUsage();
            return 1;
        }

        String command = args[0].toLowerCase(Locale.ROOT);
        String[] operands = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "duplicate":
                    out.println(DuplicateDetector.containsDuplicate(parseInts(operands, 0)));
                    return 0;

                case "anagram":
                    requireOperands(command, operands, 2);
                    out.println(AnagramChecker.isAnagram(operands[0], operands[1]));
                    return 0;

                case "two-sum":
                    requireOperands(command, operands, 3);
                    int target = Integer.parseInt(operands[0]);
                    out.println(Arrays.toString(PairSumFinder.findPair(parseInts(operands, 1), target)));
                    return 0;

                case "group":
                    out.println(createGroupingService().group(Arrays.asList(operands)));
                    return 0;

                case "top-k":
                    requireOperands(command, operands, 2);
                    int k = Integer.parseInt(operands[0]);
                    out.println(createTopKService().topKFrequent(parseInts(operands, 1), k));
                    return 0;

                case "product":
                    out.println(Arrays.toString(ProductExceptSelf.compute(parseInts(operands, 0))));
                    return 0;

                case "consecutive":
                    ConsecutiveRun run = ConsecutiveRuns.longestRun(parseInts(operands, 0));
                    out.println(run.getLength() + " " + run);
                    return 0;

                case "encode":
                    requireOperands(command, operands, 2);
                    encodeFile(Paths.get(operands[0]), Paths.get(operands[1]));
                    return 0;

                case "decode":
                    requireOperands(command, operands, 2);
                    decodeFile(Paths.get(operands[0]), Paths.get(operands[1]));
                    return 0;

                case "demo":
                    runDemo();
                    return 0;

                case "benchmark":
                    out.print(new BenchmarkSuite(config).runFullSuite().getSummary());
                    return 0;

                default:
                    System.err.println("Unknown command: " + command);
                    printUsage();
                    return 1;
            }
        } catch (MalformedEncodingException e) {
            logger.error("Decode failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (UsageException | NumberFormatException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Command '{}' failed", command, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private TopKService createTopKService() {
        return ServiceFactory.createTopKService(config);
    }

    private GroupingService createGroupingService() {
        return ServiceFactory.createGroupingService(config);
    }

    /**
     * Encode every line of the input file into a single string.
     */
    void encodeFile(Path input, Path output) throws IOException {
        requireExists(input);
        createParentDirectories(output);

        List<String> lines = Files.readAllLines(input, StandardCharsets.UTF_8);
        String encoded = ServiceFactory.createCodec(config).encode(lines);
        Files.writeString(output, encoded, StandardCharsets.UTF_8);

        logger.info("Encoded {} lines from {} into {}", lines.size(), input, output);
        out.println("Encoded " + lines.size() + " strings -> " + output);
    }

    /**
     * Decode the input file and write one string per line.
     * Strings containing a line terminator are rejected, nothing is written.
     */
    void decodeFile(Path input, Path output) throws IOException {
        requireExists(input);

        String encoded = Files.readString(input, StandardCharsets.UTF_8);
        List<String> decoded = ServiceFactory.createCodec(config).decode(encoded);
        for (int i = 0; i < decoded.size(); i++) {
            String s = decoded.get(i);
            if (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
                throw new IllegalArgumentException(
                    "Decoded string " + i + " contains a line terminator and cannot be written one per line");
            }
        }

        createParentDirectories(output);
        Files.write(output, decoded, StandardCharsets.UTF_8);

        logger.info("Decoded {} strings from {} into {}", decoded.size(), input, output);
        out.println("Decoded " + decoded.size() + " strings -> " + output);
    }

    private void runDemo() {
        LengthPrefixedCodec codec = ServiceFactory.createCodec(config);
        TopKService topK = createTopKService();
        GroupingService grouping = createGroupingService();

        out.println("containsDuplicate([1, 2, 3, 3]) = " + DuplicateDetector.containsDuplicate(new int[]{1, 2, 3, 3}));
        out.println("containsDuplicate([1, 2, 3, 4]) = " + DuplicateDetector.containsDuplicate(new int[]{1, 2, 3, 4}));
        out.println("isAnagram(racecar, carrace) = " + AnagramChecker.isAnagram("racecar", "carrace"));
        out.println("isAnagram(jar, jam) = " + AnagramChecker.isAnagram("jar", "jam"));
        out.println("twoSum([3, 4, 5, 6], 7) = " + Arrays.toString(PairSumFinder.findPair(new int[]{3, 4, 5, 6}, 7)));
        out.println("twoSum([4, 5, 6], 10) = " + Arrays.toString(PairSumFinder.findPair(new int[]{4, 5, 6}, 10)));
        out.println("twoSum([5, 5], 10) = " + Arrays.toString(PairSumFinder.findPair(new int[]{5, 5}, 10)));
        out.println("groupAnagrams([act, pots, tops, cat, stop, hat]) = "
            + grouping.group(List.of("act", "pots", "tops", "cat", "stop", "hat")));
        out.println("topKFrequent([1, 2, 2, 3, 3, 3], 2) = " + topK.topKFrequent(new int[]{1, 2, 2, 3, 3, 3}, 2));
        out.println("topKFrequent([7, 7], 1) = " + topK.topKFrequent(new int[]{7, 7}, 1));

        String encoded = codec.encode(List.of("neet", "code", "love", "you"));
        out.println("encode([neet, code, love, you]) = " + encoded);
        out.println("decode(" + encoded + ") = " + codec.decode(encoded));

        out.println("productExceptSelf([1, 2, 4, 6]) = " + Arrays.toString(ProductExceptSelf.compute(new int[]{1, 2, 4, 6})));
        out.println("productExceptSelf([-1, 0, 1, 2, 3]) = " + Arrays.toString(ProductExceptSelf.compute(new int[]{-1, 0, 1, 2, 3})));
        out.println("longestConsecutive([2, 20, 4, 10, 3, 4, 5]) = " + ConsecutiveRuns.longestLength(new int[]{2, 20, 4, 10, 3, 4, 5}));
        out.println("longestConsecutive([0, 3, 2, 5, 4, 6, 1, 1]) = " + ConsecutiveRuns.longestLength(new int[]{0, 3, 2, 5, 4, 6, 1, 1}));
    }

    private static int[] parseInts(String[] operands, int from) {
        int[] values = new int[operands.length - from];
        for (int i = from; i < operands.length; i++) {
            values[i - from] = Integer.parseInt(operands[i]);
        }
        return values;
    }

    private static void requireOperands(String command, String[] operands, int minimum) {
        if (operands.length < minimum) {
            throw new UsageException(
                "'" + command + "' needs at least " + minimum + " arguments, got " + operands.length);
        }
    }

    private static void requireExists(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new IOException("Input file does not exist: " + input);
        }
    }

    private static void createParentDirectories(Path output) throws IOException {
        Path outputDir = output.toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            Files.createDirectories(outputDir);
            logger.info("Created output directory: {}", outputDir);
        }
    }

    private void printUsage() {
        out.println("HashKit - array and hash-map algorithms");
        out.println();
        out.println("Usage:");
        out.println("  duplicate <n...>                 Check for repeated values");
        out.println("  anagram <s> <t>                  Check whether two strings are anagrams");
        out.println("  two-sum <target> <n...>          Find indices of two values adding up to target");
        out.println("  group <word...>                  Group words that are anagrams");
        out.println("  top-k <k> <n...>                 K most frequent values");
        out.println("  product <n...>                   Product of all other elements");
        out.println("  consecutive <n...>               Longest run of consecutive integers");
        out.println("  encode <input-file> <output-file> Encode lines into one length-prefixed string");
        out.println("  decode <input-file> <output-file> Decode a length-prefixed string into lines");
        out.println("  demo                             Run the worked examples");
        out.println("  benchmark                        Compare top-K and grouping strategies");
        out.println();
        out.println("Examples:");
        out.println("  java -jar hashkit.jar two-sum 7 3 4 5 6");
        out.println("  java -jar hashkit.jar top-k 2 1 2 2 3 3 3");
    }

    /**
     * Wrong number of arguments for a command.
     */
    private static class UsageException extends IllegalArgumentException {
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}
