package com.hashkit.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Length-prefixed encoding of a list of strings into a single string.
 *
 * <p>Format: for each string, its length in UTF-16 code units as a decimal
 * number, one delimiter character, then the string itself:
 * <pre>
 *   ["neet", "", "a#b"]  ->  "4#neet0#3#a#b"
 * </pre>
 * Payload boundaries come from the length, never from scanning for the
 * delimiter, so payloads may contain the delimiter and digits.
 */
public class LengthPrefixedCodec {

    private static final Logger logger = LoggerFactory.getLogger(LengthPrefixedCodec.class);

    public static final char DEFAULT_DELIMITER = '#';

    private final char delimiter;

    public LengthPrefixedCodec() {
        this(DEFAULT_DELIMITER);
    }

    public LengthPrefixedCodec(char delimiter) {
        if (Character.isDigit(delimiter)) {
            throw new IllegalArgumentException("Delimiter must not be a digit: '" + delimiter + "'");
        }
        this.delimiter = delimiter;
    }

    public char getDelimiter() {
        return delimiter;
    }

    /**
     * Encode a list of strings.
     *
     * @param strings Strings to encode; elements must not be null
     * @return Encoded string, empty for an empty list
     */
    public String encode(List<String> strings) {
        Objects.requireNonNull(strings, "strings");

        int capacity = 0;
        for (String s : strings) {
            Objects.requireNonNull(s, "strings must not contain null");
            capacity += s.length() + 4;
        }

        StringBuilder sb = new StringBuilder(capacity);
        for (String s : strings) {
            sb.append(s.length()).append(delimiter).append(s);
        }

        logger.debug("Encoded {} strings into {} chars", strings.size(), sb.length());
        return sb.toString();
    }

    /**
     * Decode a string produced by {@link #encode(List)}.
     *
     * @param encoded Encoded string
     * @return Decoded strings in their original order
     * @throws MalformedEncodingException If the input is not a valid encoding
     */
    public List<String> decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded");

        List<String> decoded = new ArrayList<>();
        int pos = 0;
        int end = encoded.length();

        while (pos < end) {
            int lengthStart = pos;
            int length = 0;

            while (pos < end && encoded.charAt(pos) != delimiter) {
                char c = encoded.charAt(pos);
                if (c < '0' || c > '9') {
                    throw new MalformedEncodingException("Expected digit but found '" + c + "'", pos);
                }
                if (length > (Integer.MAX_VALUE - (c - '0')) / 10) {
                    throw new MalformedEncodingException("Length prefix overflows", lengthStart);
                }
                length = length * 10 + (c - '0');
                pos++;
            }

            if (pos == end) {
                throw new MalformedEncodingException("Missing delimiter after length prefix", lengthStart);
            }
            if (pos == lengthStart) {
                throw new MalformedEncodingException("Empty length prefix", lengthStart);
            }

            int payloadStart = pos + 1;
            if (length > end - payloadStart) {
                throw new MalformedEncodingException(
                    "Payload of length " + length + " runs past end of input", payloadStart);
            }

            decoded.add(encoded.substring(payloadStart, payloadStart + length));
            pos = payloadStart + length;
        }

        logger.debug("Decoded {} strings from {} chars", decoded.size(), end);
        return decoded;
    }
}
