package com.wetwire.importer.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The closed set of intrinsic functions and their argument table.
 *
 * Both surface syntaxes and the code generator read this table, so adding a
 * function is a single new constant here.
 */
@Getter
public enum IntrinsicKind {

    REF("Ref", ArgumentShape.NAME, 1, 1, "ref"),
    GET_ATT("GetAtt", ArgumentShape.ATTRIBUTE_PATH, 2, 2, "getAtt"),
    SUB("Sub", ArgumentShape.TEMPLATE, 1, 2, "sub"),
    JOIN("Join", ArgumentShape.LIST, 2, 2, "join"),
    SELECT("Select", ArgumentShape.LIST, 2, 2, "select"),
    GET_AZS("GetAZs", ArgumentShape.OPTIONAL_NAME, 0, 1, "getAZs"),
    IF("If", ArgumentShape.LIST, 3, 3, "fnIf"),
    EQUALS("Equals", ArgumentShape.LIST, 2, 2, "fnEquals"),
    AND("And", ArgumentShape.LIST, 0, -1, "and"),
    OR("Or", ArgumentShape.LIST, 0, -1, "or"),
    NOT("Not", ArgumentShape.FIRST_OR_SELF, 1, 1, "not"),
    CONDITION("Condition", ArgumentShape.NAME, 1, 1, "condition"),
    FIND_IN_MAP("FindInMap", ArgumentShape.LIST, 3, 3, "findInMap"),
    BASE64("Base64", ArgumentShape.ANY, 1, 1, "base64"),
    CIDR("Cidr", ArgumentShape.LIST, 3, 3, "cidr"),
    IMPORT_VALUE("ImportValue", ArgumentShape.ANY, 1, 1, "importValue"),
    SPLIT("Split", ArgumentShape.LIST, 2, 2, "split"),
    TRANSFORM("Transform", ArgumentShape.ANY, 1, 1, "transform"),
    VALUE_OF("ValueOf", ArgumentShape.LIST, 2, -1, "valueOf");

    private static final String LONG_FORM_PREFIX = "Fn::";

    private static final Map<String, IntrinsicKind> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(IntrinsicKind::getTagName, Function.identity()));

    private static final Map<String, IntrinsicKind> BY_LONG_FORM_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(IntrinsicKind::getLongFormKey, Function.identity()));

    /** Short-form tag without the leading "!", e.g. "GetAtt". */
    private final String tagName;
    private final ArgumentShape shape;
    private final int minArgs;
    /** Maximum positional arguments kept, or -1 for unbounded. */
    private final int maxArgs;
    /** Name of the helper function emitted in generated code. */
    private final String functionName;

    IntrinsicKind(String tagName, ArgumentShape shape, int minArgs, int maxArgs, String functionName) {
        this.tagName = tagName;
        this.shape = shape;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.functionName = functionName;
    }

    /**
     * Key used by the function-prefixed map syntax: "Ref", "Condition" or "Fn::Name".
     */
    public String getLongFormKey() {
        if (this == REF || this == CONDITION) {
            return tagName;
        }
        return LONG_FORM_PREFIX + tagName;
    }

    public static Optional<IntrinsicKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String name = tag.startsWith("!") ? tag.substring(1) : tag;
        return Optional.ofNullable(BY_TAG.get(name));
    }

    public static Optional<IntrinsicKind> fromLongFormKey(String key) {
        return Optional.ofNullable(BY_LONG_FORM_KEY.get(key));
    }
}
