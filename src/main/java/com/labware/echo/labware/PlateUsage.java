package com.labware.echo.labware;

import java.util.Locale;

import com.labware.echo.codec.ScalarCodec;
import com.labware.echo.codec.ScalarType;

/**
 * Role of a plate type on the instrument.
 */
public enum PlateUsage {
    SOURCE("SRC"),
    DESTINATION("DEST");

    /**
     * Reads {@code SRC}/{@code DEST} (and the spelled-out names), writes the short codes.
     */
    public static final ScalarCodec<PlateUsage> CODEC = new ScalarCodec<>() {
        @Override
        public PlateUsage decode(String raw) {
            return fromCode(raw);
        }

        @Override
        public String encode(PlateUsage value) {
            return value.getCode();
        }

        @Override
        public ScalarType type() {
            return ScalarType.STRING;
        }
    };

    private final String code;

    PlateUsage(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static PlateUsage fromCode(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toUpperCase(Locale.ROOT);
            for (PlateUsage usage : values()) {
                if (usage.code.equals(normalized) || usage.name().equals(normalized)) {
                    return usage;
                }
            }
        }
        throw new IllegalArgumentException("unknown plate usage, expected SRC or DEST");
    }
}
