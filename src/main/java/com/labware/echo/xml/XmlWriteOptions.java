package com.labware.echo.xml;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.Value;

/**
 * Serializer settings.
 */
@Value
@Builder(toBuilder = true)
public class XmlWriteOptions {

    public static final XmlWriteOptions DEFAULTS = XmlWriteOptions.builder().build();

    @Builder.Default
    boolean indent = true;

    @Builder.Default
    int indentAmount = 2;

    @Builder.Default
    boolean xmlDeclaration = true;

    @Builder.Default
    Charset encoding = StandardCharsets.UTF_8;
}
