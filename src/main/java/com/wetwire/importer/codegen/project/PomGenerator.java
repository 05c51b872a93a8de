package com.wetwire.importer.codegen.project;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.TemplateException;

/**
 * Generates the Maven pom.xml for a scaffolded import.
 */
public class PomGenerator {

    // Keep versions centralized so later upgrades are easy.
    private static final String RUNTIME_GROUP_ID = "dev.wetwire";
    private static final String RUNTIME_ARTIFACT_ID = "wetwire-aws";
    private static final String RUNTIME_VERSION = "1.0.0";
    private static final String JAVA_VERSION = "17";

    private static final String POM_TEMPLATE = "scaffold/pom.xml.ftl";

    private final Configuration freemarkerConfig;

    public PomGenerator(Configuration freemarkerConfig) {
        this.freemarkerConfig = freemarkerConfig;
    }

    public String generatePomContent(PomInfo pomInfo) {
        Map<String, Object> model = new HashMap<>();
        model.put("groupId", pomInfo.groupId());
        model.put("artifactId", pomInfo.artifactId());
        model.put("version", pomInfo.version());
        model.put("name", pomInfo.name());
        model.put("description", pomInfo.description());
        model.put("javaVersion", JAVA_VERSION);
        model.put("runtimeGroupId", RUNTIME_GROUP_ID);
        model.put("runtimeArtifactId", RUNTIME_ARTIFACT_ID);
        model.put("runtimeVersion", RUNTIME_VERSION);

        try {
            StringWriter out = new StringWriter();
            freemarkerConfig.getTemplate(POM_TEMPLATE).process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + POM_TEMPLATE + ": " + e.getMessage(), e);
        }
    }

    /**
     * Minimal info needed to generate a pom.xml without binding to GeneratorConfig field names.
     */
    public record PomInfo(
            String groupId,
            String artifactId,
            String version,
            String name,
            String description
    ) {}
}
