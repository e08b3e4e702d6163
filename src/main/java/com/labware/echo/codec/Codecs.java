package com.labware.echo.codec;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Plain scalar codecs and the canonical number formatting shared by all of them.
 */
public final class Codecs {

    public static final ScalarCodec<String> STRING = new ScalarCodec<>() {
        @Override
        public String decode(String raw) {
            return raw;
        }

        @Override
        public String encode(String value) {
            return value;
        }

        @Override
        public ScalarType type() {
            return ScalarType.STRING;
        }
    };

    public static final ScalarCodec<Integer> INTEGER = new IntegerCodec(false);

    public static final ScalarCodec<Integer> NON_NEGATIVE_INTEGER = new IntegerCodec(true);

    public static final ScalarCodec<Double> FLOAT = new ScalarCodec<>() {
        @Override
        public Double decode(String raw) {
            return parseDouble(raw);
        }

        @Override
        public String encode(Double value) {
            return formatDouble(value);
        }

        @Override
        public ScalarType type() {
            return ScalarType.FLOAT;
        }
    };

    public static final ScalarCodec<String> BARCODE = new BarcodeCodec();

    public static final ScalarCodec<Double> ZERO_AS_ABSENT_FLOAT = new ZeroAsAbsentFloatCodec();

    public static final ScalarCodec<LocalDateTime> TIMESTAMP = new TimestampCodec();

    private Codecs() {
        // Utility class
    }

    static double parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty number");
        }
        return Double.parseDouble(raw.trim());
    }

    /**
     * Formats a float in plain notation with trailing zeros stripped, so
     * {@code 12.50} becomes {@code 12.5} and {@code 1.0} becomes {@code 1}.
     */
    public static String formatDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static final class IntegerCodec implements ScalarCodec<Integer> {
        private final boolean nonNegative;

        private IntegerCodec(boolean nonNegative) {
            this.nonNegative = nonNegative;
        }

        @Override
        public Integer decode(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("empty integer");
            }
            int value = Integer.parseInt(raw.trim());
            if (nonNegative && value < 0) {
                throw new IllegalArgumentException("must be non-negative");
            }
            return value;
        }

        @Override
        public String encode(Integer value) {
            if (nonNegative && value < 0) {
                throw new IllegalArgumentException("must be non-negative: " + value);
            }
            return Integer.toString(value);
        }

        @Override
        public ScalarType type() {
            return ScalarType.INTEGER;
        }
    }
}
