package com.wetwire.importer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A stack output, optionally exported under a name.
 */
@Value
@Builder
public class Output {

    @NonNull
    String logicalId;

    @NonNull
    IrValue value;

    String description;
    IrValue exportName;
    String condition;
}
