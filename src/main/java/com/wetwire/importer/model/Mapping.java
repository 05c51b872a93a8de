package com.wetwire.importer.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A static two-level lookup table: top key, then second key, then value.
 */
@Value
@Builder
public class Mapping {

    @NonNull
    String logicalId;

    @Singular
    Map<String, Map<String, IrValue>> entries;
}
