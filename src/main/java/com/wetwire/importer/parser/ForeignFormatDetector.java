package com.wetwire.importer.parser;

import java.util.regex.Pattern;

import com.wetwire.importer.parser.tree.TreeMapping;

/**
 * Rejects documents that look like templates but belong to another tool.
 */
public final class ForeignFormatDetector {

    private static final String RAIN_TAG_PREFIX = "!Rain::";

    private static final Pattern API_VERSION_FIELD =
            Pattern.compile("^[\"']?apiVersion[\"']?\\s*:", Pattern.MULTILINE);
    private static final Pattern KIND_FIELD =
            Pattern.compile("^[\"']?kind[\"']?\\s*:", Pattern.MULTILINE);

    private ForeignFormatDetector() {
        // Utility class
    }

    /**
     * Checks the raw text before any parsing is attempted.
     *
     * @throws TemplateParseException if the content is a foreign format
     */
    public static void checkContent(String content) {
        if (content.contains(RAIN_TAG_PREFIX)) {
            throw new TemplateParseException(
                    "unsupported format: template uses Rain-specific tags (!Rain::)");
        }
        if (API_VERSION_FIELD.matcher(content).find() && KIND_FIELD.matcher(content).find()) {
            throw new TemplateParseException(
                    "unsupported format: content looks like a Kubernetes manifest (apiVersion/kind)");
        }
    }

    /**
     * Checks the decoded root, which also covers manifests written as JSON.
     *
     * @throws TemplateParseException if the root is a foreign format
     */
    public static void checkRoot(TreeMapping root) {
        if (root.containsKey("apiVersion") && root.containsKey("kind")) {
            throw new TemplateParseException(
                    "unsupported format: content looks like a Kubernetes manifest (apiVersion/kind)");
        }
    }
}
