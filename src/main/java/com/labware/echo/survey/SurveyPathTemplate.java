package com.labware.echo.survey;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.labware.echo.codec.ScalarCodec;
import com.labware.echo.xml.XmlField;
import com.labware.echo.xml.XmlRecord;

/**
 * File name pattern filled from a survey's header fields, e.g.
 * {@code "surveys/{plate_type}-{plate_barcode}-{timestamp}.xml"}.
 *
 * Placeholders are logical header field names. Values render in their wire
 * form, except {@code timestamp}, which renders as {@code yyyyMMdd-HHmmss}.
 * Absent optional fields render as the empty string.
 */
public final class SurveyPathTemplate implements Function<EchoPlateSurvey, Path> {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final String pattern;

    private SurveyPathTemplate(String pattern) {
        this.pattern = pattern;
    }

    /**
     * @throws IllegalArgumentException if a placeholder names no header field
     */
    public static SurveyPathTemplate of(String pattern) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        while (matcher.find()) {
            headerField(matcher.group(1));
        }
        return new SurveyPathTemplate(pattern);
    }

    @Override
    public Path apply(EchoPlateSurvey survey) {
        return Path.of(render(survey));
    }

    public String render(EchoPlateSurvey survey) {
        XmlRecord header = SurveySchemas.headerRecord(survey);
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(renderValue(headerField(name), header.get(name))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public String getPattern() {
        return pattern;
    }

    @SuppressWarnings("unchecked")
    private static String renderValue(XmlField field, Object value) {
        ScalarCodec<Object> codec = (ScalarCodec<Object>) field.getCodec();
        if (value == null) {
            return codec.encodesAbsence() ? codec.encode(null) : "";
        }
        if ("timestamp".equals(field.getName())) {
            return TIMESTAMP.format((LocalDateTime) value);
        }
        return codec.encode(value);
    }

    private static XmlField headerField(String name) {
        return SurveySchemas.PLATE_SURVEY.field(name)
                .filter(XmlField::isScalar)
                .orElseThrow(() -> new IllegalArgumentException("Unknown survey field {" + name + "} in path template"));
    }

    @Override
    public String toString() {
        return pattern;
    }
}
