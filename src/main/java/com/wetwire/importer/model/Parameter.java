package com.wetwire.importer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared input parameter.
 */
@Value
@Builder
public class Parameter {

    @NonNull
    String logicalId;

    @Builder.Default
    String type = "String";

    String description;
    IrValue defaultValue;

    @Singular
    List<IrValue> allowedValues;

    String allowedPattern;
    String minLength;
    String maxLength;
    String minValue;
    String maxValue;
    String constraintDescription;
    boolean noEcho;
}
