package com.labware.echo.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the scalar codecs.
 */
class CodecsTest {

    @ParameterizedTest
    @CsvSource({
            "12.5, 12.5",
            "12.50, 12.5",
            "1.0, 1",
            "0.0, 0",
            "-0.0, 0",
            "1000000, 1000000",
            "0.0001, 0.0001"
    })
    void testFormatDouble(double value, String expected) {
        assertThat(Codecs.formatDouble(value)).isEqualTo(expected);
    }

    @Test
    void testIntegerRejectsGarbage() {
        assertThatThrownBy(() -> Codecs.INTEGER.decode("12a"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Codecs.INTEGER.decode(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNonNegativeIntegerRejectsNegative() {
        assertThat(Codecs.INTEGER.decode("-3")).isEqualTo(-3);
        assertThatThrownBy(() -> Codecs.NON_NEGATIVE_INTEGER.decode("-3"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Codecs.NON_NEGATIVE_INTEGER.encode(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBarcodeSentinel() {
        assertThat(Codecs.BARCODE.decode("UnknownBarCode")).isNull();
        assertThat(Codecs.BARCODE.decode("PLATE-001")).isEqualTo("PLATE-001");
        assertThat(Codecs.BARCODE.encode(null)).isEqualTo(BarcodeCodec.UNKNOWN_BARCODE);
        assertThat(Codecs.BARCODE.encode("PLATE-001")).isEqualTo("PLATE-001");
        assertThat(Codecs.BARCODE.encodesAbsence()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({"0", "0.0", "0.00", "-0"})
    void testZeroDecodesAsAbsent(String raw) {
        assertThat(Codecs.ZERO_AS_ABSENT_FLOAT.decode(raw)).isNull();
    }

    @Test
    void testZeroAsAbsentEncoding() {
        assertThat(Codecs.ZERO_AS_ABSENT_FLOAT.decode("41.25")).isEqualTo(41.25);
        assertThat(Codecs.ZERO_AS_ABSENT_FLOAT.encode(null)).isEqualTo("0");
        assertThat(Codecs.ZERO_AS_ABSENT_FLOAT.encode(41.25)).isEqualTo("41.25");
    }

    @ParameterizedTest
    @CsvSource({
            "2023-04-12 15:02:33, 2023-04-12 15:02:33",
            "2023-04-12 15:02:33.417, 2023-04-12 15:02:33.417",
            "2023-04-12T15:02:33.4, 2023-04-12 15:02:33.400",
            "2023-04-12 15:02:33.123456, 2023-04-12 15:02:33.123456",
            "2023-04-12 15:02:33.123456789, 2023-04-12 15:02:33.123456789"
    })
    void testTimestampCanonicalForm(String raw, String expected) {
        LocalDateTime decoded = Codecs.TIMESTAMP.decode(raw);

        assertThat(Codecs.TIMESTAMP.encode(decoded)).isEqualTo(expected);
    }

    @Test
    void testTimestampValue() {
        assertThat(Codecs.TIMESTAMP.decode("2023-04-12 15:02:33.417"))
                .isEqualTo(LocalDateTime.of(2023, 4, 12, 15, 2, 33, 417_000_000));
    }

    @ParameterizedTest
    @CsvSource({
            "2023-04-12T15:02:33+00:00",
            "2023-04-12T15:02:33Z",
            "2023-04-12 15:02:33+02:00"
    })
    void testTimestampKeepsWallClockAndDropsOffset(String raw) {
        assertThat(Codecs.TIMESTAMP.decode(raw)).isEqualTo(LocalDateTime.of(2023, 4, 12, 15, 2, 33));
        assertThat(Codecs.TIMESTAMP.encode(Codecs.TIMESTAMP.decode(raw))).isEqualTo("2023-04-12 15:02:33");
    }

    @Test
    void testTimestampRejectsGarbage() {
        assertThatThrownBy(() -> Codecs.TIMESTAMP.decode("yesterday"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testColumnTypes() {
        assertThat(Codecs.BARCODE.type()).isEqualTo(ScalarType.STRING);
        assertThat(Codecs.ZERO_AS_ABSENT_FLOAT.type()).isEqualTo(ScalarType.FLOAT);
        assertThat(Codecs.TIMESTAMP.type().getJavaType()).isEqualTo(LocalDateTime.class);
    }
}
