package com.labware.echo.survey;

import java.io.IOException;
import java.nio.file.Path;

import com.labware.echo.util.FileWriteUtil;
import com.labware.echo.xml.XmlMapper;
import com.labware.echo.xml.XmlWriteOptions;

public class PlateSurveyXmlWriter {

    private final XmlMapper mapper = new XmlMapper();

    public byte[] write(EchoPlateSurvey survey, XmlWriteOptions options) {
        return mapper.toBytes(SurveySchemas.PLATE_SURVEY, SurveySchemas.toRecord(survey), options);
    }

    /**
     * @return the path written
     */
    public Path write(EchoPlateSurvey survey, Path path, XmlWriteOptions options) throws IOException {
        FileWriteUtil.safeWrite(path, write(survey, options));
        return path;
    }
}
