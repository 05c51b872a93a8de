package com.wetwire.importer.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import javax.lang.model.SourceVersion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.catalog.ResourceTypeInfo;
import com.wetwire.importer.codegen.context.GenerationContext;
import com.wetwire.importer.codegen.util.NamingUtil;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.model.Resource;

/**
 * Generates the declaration of one resource, preceded by its extracted blocks.
 */
public class ResourceDeclarationGenerator {

    private static final Logger log = LoggerFactory.getLogger(ResourceDeclarationGenerator.class);

    private static final String TAGS_PROPERTY = "Tags";
    private static final int CALL_INDENT = DeclarationWriter.MEMBER_INDENT + ValueRenderer.CONTINUATION_INDENT;

    private final GenerationContext context;
    private final ValueRenderer values;
    private final PropertyBlockExtractor blocks;

    public ResourceDeclarationGenerator(GenerationContext context, ValueRenderer values) {
        this.context = context;
        this.values = values;
        this.blocks = new PropertyBlockExtractor(context, values);
    }

    /**
     * Returns the members for the resource: extracted blocks first, then the resource itself.
     */
    public List<String> generate(Resource resource) {
        context.setCurrentResource(resource.getLogicalId());
        Optional<ResourceTypeInfo> typeInfo = context.getCatalog().lookup(resource.getType());

        List<String> declarations = new ArrayList<>();
        String typeName;
        String head;
        String unknownComment = null;
        if (typeInfo.isPresent()) {
            typeName = context.getImportManager().reference(typeInfo.get().getQualifiedName());
            head = typeName + ".builder()";
        } else {
            warn("Unknown resource type " + resource.getType() + " for " + resource.getLogicalId()
                    + "; emitted as a generic resource");
            unknownComment = DeclarationWriter.comment("Unknown resource type: " + resource.getType());
            typeName = context.runtimeType("GenericResource");
            head = typeName + ".builder(" + ValueRenderer.quote(resource.getType()) + ")";
        }

        List<String> calls = new ArrayList<>();
        for (String name : new TreeSet<>(resource.getProperties().keySet())) {
            context.setCurrentProperty(name);
            String value = renderProperty(resource, typeInfo, name, resource.getProperties().get(name), declarations);
            if (typeInfo.isPresent() && SourceVersion.isIdentifier(name) && typeInfo.get().declaresProperty(name)) {
                calls.add("." + NamingUtil.toSetterName(name) + "(" + value + ")");
            } else {
                if (typeInfo.isPresent()) {
                    warn("Property " + name + " of " + resource.getLogicalId() + " is not declared by "
                            + typeInfo.get().getQualifiedName() + "; emitted as a generic property");
                }
                calls.add(".property(" + ValueRenderer.quote(name) + ", " + value + ")");
            }
        }
        context.setCurrentProperty(null);
        calls.addAll(attributeCalls(resource));

        String initializer = values.chain(head, calls, DeclarationWriter.MEMBER_INDENT);
        String declaration = DeclarationWriter.member(typeName, context.memberName(resource.getLogicalId()), initializer);
        declarations.add(unknownComment == null ? declaration : unknownComment + "\n" + declaration);

        log.debug("Generated resource {} ({} block(s))", resource.getLogicalId(), declarations.size() - 1);
        context.setCurrentResource(null);
        return declarations;
    }

    private String renderProperty(Resource resource, Optional<ResourceTypeInfo> typeInfo, String name,
                                  IrValue value, List<String> declarations) {
        String ownerType = typeInfo.map(ResourceTypeInfo::getQualifiedName).orElse(null);
        if (value instanceof IrList list) {
            if (TAGS_PROPERTY.equals(name)) {
                return blocks.extractTags(list, CALL_INDENT, declarations);
            }
            Optional<String> elementType = BlockProperties.elementType(resource.getType(), name);
            if (ownerType != null && elementType.isPresent()) {
                return blocks.extractBlocks(list, ownerType + "." + elementType.get(), CALL_INDENT, declarations);
            }
        }
        return values.render(value, ownerType, name, CALL_INDENT);
    }

    private List<String> attributeCalls(Resource resource) {
        List<String> calls = new ArrayList<>();
        if (!resource.getDependsOn().isEmpty()) {
            List<String> targets = new ArrayList<>();
            for (String target : resource.getDependsOn()) {
                targets.add(context.getTemplate().hasResource(target)
                        ? context.memberName(target)
                        : ValueRenderer.quote(target));
            }
            calls.add(values.call(".dependsOn", targets, CALL_INDENT));
        }
        if (resource.getCondition() != null) {
            calls.add(".condition(" + ValueRenderer.quote(resource.getCondition()) + ")");
        }
        if (resource.getDeletionPolicy() != null) {
            calls.add(".deletionPolicy(" + ValueRenderer.quote(resource.getDeletionPolicy()) + ")");
        }
        if (resource.getUpdateReplacePolicy() != null) {
            calls.add(".updateReplacePolicy(" + ValueRenderer.quote(resource.getUpdateReplacePolicy()) + ")");
        }
        if (resource.getMetadata() != null) {
            calls.add(".metadata(" + values.renderUntypedMap(resource.getMetadata(), CALL_INDENT) + ")");
        }
        return calls;
    }

    private void warn(String message) {
        log.warn(message);
        context.getDiagnostics().addWarning(message);
    }
}
