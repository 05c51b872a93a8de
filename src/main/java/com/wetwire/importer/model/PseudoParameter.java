package com.wetwire.importer.model;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

/**
 * Environment-provided parameters that a template may reference without declaring.
 */
@Getter
public enum PseudoParameter {

    ACCOUNT_ID("AWS::AccountId", "AWS_ACCOUNT_ID"),
    NOTIFICATION_ARNS("AWS::NotificationARNs", "AWS_NOTIFICATION_ARNS"),
    NO_VALUE("AWS::NoValue", "AWS_NO_VALUE"),
    PARTITION("AWS::Partition", "AWS_PARTITION"),
    REGION("AWS::Region", "AWS_REGION"),
    STACK_ID("AWS::StackId", "AWS_STACK_ID"),
    STACK_NAME("AWS::StackName", "AWS_STACK_NAME"),
    URL_SUFFIX("AWS::URLSuffix", "AWS_URL_SUFFIX");

    /** Every pseudo-parameter, known or not, lives under this prefix. */
    public static final String RESERVED_PREFIX = "AWS::";

    private final String templateName;
    private final String constantName;

    PseudoParameter(String templateName, String constantName) {
        this.templateName = templateName;
        this.constantName = constantName;
    }

    public static boolean isReserved(String name) {
        return name != null && name.startsWith(RESERVED_PREFIX);
    }

    public static Optional<PseudoParameter> fromTemplateName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.templateName.equals(name))
                .findFirst();
    }
}
