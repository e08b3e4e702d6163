package com.labware.echo.survey;

import com.labware.echo.exception.InvalidFieldValueException;
import com.labware.echo.exception.MissingRequiredFieldException;
import com.labware.echo.exception.SchemaViolationException;
import com.labware.echo.validation.CollectingDiagnosticSink;
import com.labware.echo.validation.SurveyValidator;
import com.labware.echo.xml.XmlDocuments;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for reading, validating and writing plate surveys.
 */
class EchoPlateSurveyTest {

    @TempDir
    Path tempDir;

    private static byte[] sample() throws IOException {
        try (InputStream in = EchoPlateSurveyTest.class.getResourceAsStream("/survey/platesurvey-sample.xml")) {
            return in.readAllBytes();
        }
    }

    private static String survey(String attributes, int wells) {
        StringBuilder sb = new StringBuilder();
        sb.append("<platesurvey name=\"384PP_DMSO2\" barcode=\"P1\" date=\"2023-04-12 15:02:33\" ")
                .append("serial_number=\"E5XX-1234\" vtl=\"1\" original=\"0\" rows=\"1\" cols=\"2\" ")
                .append(attributes).append(">");
        for (int i = 0; i < wells; i++) {
            sb.append("<w r=\"0\" c=\"").append(i).append("\" n=\"A").append(i + 1)
                    .append("\" vl=\"10\" cvl=\"10\" status=\"\" fld=\"DMSO\" fldu=\"%\" x=\"0\" y=\"0\" s=\"90\"")
                    .append(" fsh=\"0\" fsinh=\"0\" t=\"1\" ct=\"1\" b=\"1\" fth=\"0\" ftinh=\"0\" o=\"0\" a=\"None\">")
                    .append("<e t=\"EchoSignal\" x=\"0\" y=\"0\" z=\"0\"/></w>");
        }
        sb.append("</platesurvey>");
        return sb.toString();
    }

    @Test
    void testReadSample() throws IOException {
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample(), sink);

        assertThat(survey.getPlateType()).isEqualTo("384PP_DMSO2");
        assertThat(survey.getPlateBarcode()).isNull();
        assertThat(survey.getTimestamp()).isEqualTo(LocalDateTime.of(2023, 4, 12, 15, 2, 33, 417_000_000));
        assertThat(survey.getInstrumentSerialNumber()).isEqualTo("E5XX-1234");
        assertThat(survey.getDataFormatVersion()).isEqualTo(1);
        assertThat(survey.getSurveyTotalWells()).isEqualTo(3);
        assertThat(survey.getPlateName()).isNull();
        assertThat(sink.hasWarnings()).isFalse();

        assertThat(survey.getWells()).extracting(WellSurvey::getWell).containsExactly("A1", "A2", "A3");
        WellSurvey a1 = survey.getWells().get(0);
        assertThat(a1.getVolume()).isEqualTo(41.25);
        assertThat(a1.getFluidComposition()).isEqualTo(92.5);
        assertThat(a1.getCorrectiveAction()).isEqualTo("None");
        assertThat(a1.getEchoSignal().getFeatures())
                .extracting(SignalFeature::getFeatureType)
                .containsExactly("BB", "TB", "SR");
        assertThat(a1.getEchoSignal().getFeatures().get(2).getTof()).isEqualTo(8.9);
    }

    @Test
    void testZeroVolumeIsAbsent() throws IOException {
        WellSurvey a2 = EchoPlateSurvey.fromBytes(sample()).getWells().get(1);

        assertThat(a2.getVolume()).isNull();
        assertThat(a2.getCurrentVolume()).isNull();
        assertThat(a2.getStatus()).isEqualTo("Empty");
        assertThat(a2.getEchoSignal().getFeatures()).isEmpty();
    }

    @Test
    void testTooFewWells() {
        byte[] raw = survey("frmt=\"1\" totalWells=\"2\"", 1).getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> EchoPlateSurvey.fromBytes(raw))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessage("Number of well data items (1) does not match reported (2)");
    }

    @Test
    void testTooManyWells() {
        byte[] raw = survey("frmt=\"1\" totalWells=\"1\"", 2).getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> EchoPlateSurvey.fromBytes(raw))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("(2)")
                .hasMessageContaining("(1)");
    }

    @Test
    void testEmptySurvey() {
        byte[] raw = survey("frmt=\"1\" totalWells=\"0\"", 0).getBytes(StandardCharsets.UTF_8);

        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(raw);

        assertThat(survey.getWells()).isEmpty();
        assertThat(survey.toTable().rowCount()).isZero();
    }

    @Test
    void testUnexpectedFormatVersionWarns() {
        byte[] raw = survey("frmt=\"2\" totalWells=\"2\"", 2).getBytes(StandardCharsets.UTF_8);
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(raw, sink);

        assertThat(survey.getDataFormatVersion()).isEqualTo(2);
        assertThat(sink.getCodes()).containsExactly(SurveyValidator.FORMAT_VERSION);
        assertThat(sink.getWarnings().get(0).getMessage()).contains("2");
    }

    @Test
    void testMissingHeaderAttribute() {
        byte[] raw = survey("totalWells=\"0\"", 0).getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> EchoPlateSurvey.fromBytes(raw))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("frmt");
    }

    @Test
    void testBadTimestamp() {
        byte[] raw = survey("frmt=\"1\" totalWells=\"0\"", 0).replace("2023-04-12 15:02:33", "last tuesday")
                .getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> EchoPlateSurvey.fromBytes(raw))
                .isInstanceOf(InvalidFieldValueException.class)
                .hasMessageContaining("date");
    }

    @Test
    void testRoundTrip() throws IOException {
        EchoPlateSurvey original = EchoPlateSurvey.fromBytes(sample());

        byte[] written = original.toBytes();
        EchoPlateSurvey reread = EchoPlateSurvey.fromBytes(written);

        assertThat(reread).isEqualTo(original);
        assertThat(reread.getWells()).extracting(WellSurvey::getWell).containsExactly("A1", "A2", "A3");
    }

    @Test
    void testCanonicalSampleRewritesByteForByte() throws IOException {
        byte[] sample = sample();

        assertThat(EchoPlateSurvey.fromBytes(sample).toBytes()).isEqualTo(sample);
    }

    @Test
    void testWrittenWireForm() throws IOException {
        EchoPlateSurvey original = EchoPlateSurvey.fromBytes(sample());

        Element root = XmlDocuments.parse(original.toBytes()).getDocumentElement();

        assertThat(root.getTagName()).isEqualTo("platesurvey");
        assertThat(root.getAttribute("barcode")).isEqualTo("UnknownBarCode");
        assertThat(root.getAttribute("date")).isEqualTo("2023-04-12 15:02:33.417");
        assertThat(root.hasAttribute("plate_name")).isFalse();
        assertThat(root.hasAttribute("note")).isFalse();
        List<Element> wells = XmlDocuments.childElements(root, "w");
        assertThat(wells).hasSize(3);
        assertThat(wells.get(1).getAttribute("vl")).isEqualTo("0");
        assertThat(wells.get(0).getAttribute("vl")).isEqualTo("41.25");
        assertThat(XmlDocuments.childElements(XmlDocuments.childElements(wells.get(0), "e").get(0), "f")).hasSize(3);
    }

    @Test
    void testOptionalHeaderFieldsRoundTrip() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample()).toBuilder()
                .plateBarcode("PLATE-42")
                .plateName("Compound library 7")
                .comment("resurveyed")
                .build();

        EchoPlateSurvey reread = EchoPlateSurvey.fromBytes(survey.toBytes());

        assertThat(reread.getPlateBarcode()).isEqualTo("PLATE-42");
        assertThat(reread.getPlateName()).isEqualTo("Compound library 7");
        assertThat(reread.getComment()).isEqualTo("resurveyed");
    }

    @Test
    void testToBuilderRevalidates() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample());

        assertThatThrownBy(() -> survey.toBuilder().surveyTotalWells(4).build())
                .isInstanceOf(SchemaViolationException.class);
        assertThatThrownBy(() -> survey.toBuilder().clearWells().build())
                .isInstanceOf(SchemaViolationException.class);

        EchoPlateSurvey trimmed = survey.toBuilder()
                .clearWells()
                .well(survey.getWells().get(0))
                .surveyTotalWells(1)
                .build();
        assertThat(trimmed.getWells()).hasSize(1);
    }

    @Test
    void testNegativeGridSizeRejected() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample());

        assertThatThrownBy(() -> survey.toBuilder().surveyRows(-5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("surveyRows");
        assertThatThrownBy(() -> survey.toBuilder().surveyColumns(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("surveyColumns");
    }

    @Test
    void testNegativeWellPositionRejected() throws IOException {
        WellSurvey well = EchoPlateSurvey.fromBytes(sample()).getWells().get(0);

        assertThatThrownBy(() -> well.toBuilder().row(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("row");
        assertThatThrownBy(() -> well.toBuilder().column(-3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("column");
        assertThat(well.toBuilder().row(0).column(0).build()).isEqualTo(well);
    }

    @Test
    void testWellsAreImmutable() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample());

        assertThatThrownBy(() -> survey.getWells().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testWriteAndReadFile() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample());
        Path target = tempDir.resolve("surveys/plate.xml");

        Path written = survey.write(target);

        assertThat(written).isEqualTo(target);
        assertThat(Files.exists(target)).isTrue();
        assertThat(EchoPlateSurvey.read(target)).isEqualTo(survey);
    }

    @Test
    void testWriteWithPathFunction() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample());

        Path written = survey.write(s -> tempDir.resolve(s.getPlateType() + ".xml"));

        assertThat(written).isEqualTo(tempDir.resolve("384PP_DMSO2.xml"));
        assertThat(EchoPlateSurvey.read(written).getWells()).hasSize(3);
    }

    @Test
    void testWriteWithTemplate() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample());
        SurveyPathTemplate template = SurveyPathTemplate.of(tempDir + "/{plate_type}-{timestamp}.xml");

        Path written = survey.write(template);

        assertThat(written.getFileName().toString()).isEqualTo("384PP_DMSO2-20230412-150233.xml");
        assertThat(Files.exists(written)).isTrue();
    }

    @Test
    void testValidateReportsThroughSink() throws IOException {
        EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(sample()).toBuilder().dataFormatVersion(3).build();
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

        survey.validate(sink);

        assertThat(sink.getCodes()).containsExactly(SurveyValidator.FORMAT_VERSION);
    }
}
