package com.labware.echo.survey;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import com.labware.echo.validation.DiagnosticSink;
import com.labware.echo.validation.SurveyValidator;
import com.labware.echo.xml.XmlDocuments;
import com.labware.echo.xml.XmlMapper;
import com.labware.echo.xml.XmlRecord;

/**
 * Parses {@code platesurvey} documents: structural parse, scalar decode, then
 * the survey checks. Advisories go to the injected sink.
 */
public class PlateSurveyXmlReader {

    private static final Logger log = LoggerFactory.getLogger(PlateSurveyXmlReader.class);

    private final XmlMapper mapper = new XmlMapper();
    private final DiagnosticSink sink;

    public PlateSurveyXmlReader(DiagnosticSink sink) {
        this.sink = sink;
    }

    public EchoPlateSurvey read(Path path) throws IOException {
        log.debug("Reading plate survey file {}", path);
        return read(Files.readAllBytes(path));
    }

    public EchoPlateSurvey read(byte[] raw) {
        Element root = XmlDocuments.parse(raw).getDocumentElement();
        XmlRecord record = mapper.read(root, SurveySchemas.PLATE_SURVEY);
        EchoPlateSurvey survey = SurveySchemas.surveyFromRecord(record);
        SurveyValidator.validate(survey, sink);
        return survey;
    }
}
