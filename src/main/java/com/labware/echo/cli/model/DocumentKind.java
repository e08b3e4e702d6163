package com.labware.echo.cli.model;

import com.labware.echo.exception.MalformedXmlException;
import com.labware.echo.labware.LabwareSchemas;
import com.labware.echo.survey.SurveySchemas;
import com.labware.echo.xml.XmlDocuments;

/**
 * Which dialect an input file is in.
 */
public enum DocumentKind {
    AUTO,
    LABWARE,
    SURVEY;

    /**
     * Picks the dialect from the root element.
     *
     * @throws MalformedXmlException if the input is not XML or the root is neither dialect's
     */
    public static DocumentKind detect(byte[] raw) {
        String root = XmlDocuments.parse(raw).getDocumentElement().getTagName();
        if (LabwareSchemas.ROOT_TAG.equals(root)) {
            return LABWARE;
        }
        if (SurveySchemas.PLATE_SURVEY.getTag().equals(root)) {
            return SURVEY;
        }
        throw new MalformedXmlException("Unrecognized root element <" + root + ">, expected <"
                + LabwareSchemas.ROOT_TAG + "> or <" + SurveySchemas.PLATE_SURVEY.getTag() + ">");
    }
}
