package com.wetwire.importer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A named boolean expression.
 */
@Value
@Builder
public class Condition {

    @NonNull
    String logicalId;

    @NonNull
    IrValue expression;
}
