package com.wetwire.importer.analysis;

import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.model.Intrinsic;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.model.IrValueVisitor;
import com.wetwire.importer.model.PseudoParameter;
import com.wetwire.importer.model.Template;

/**
 * Builds the reference graph by walking resource properties and output values.
 *
 * Never fails: references to undeclared ids are recorded as they are.
 */
public class ReferenceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReferenceAnalyzer.class);

    static final Pattern SUB_VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");

    public ReferenceGraph analyze(Template template) {
        ReferenceGraph graph = new ReferenceGraph();

        template.getResources().forEach((id, resource) -> {
            graph.addNode(id);
            ReferenceCollector collector = new ReferenceCollector(target -> graph.addEdge(id, target));
            resource.getProperties().values().forEach(value -> value.accept(collector));
        });

        template.getOutputs().forEach((id, output) -> {
            graph.addOutputNode(id);
            output.getValue().accept(new ReferenceCollector(target -> graph.addOutputEdge(id, target)));
        });

        log.debug("Reference graph has {} edges", graph.edgeCount());
        return graph;
    }

    /**
     * Names interpolated by a Sub template, excluding pseudo-parameters,
     * escaped literals and variables bound by the Sub itself.
     */
    static void collectSubReferences(String subTemplate, IrMap boundVariables, Consumer<String> sink) {
        if (subTemplate == null) {
            return;
        }
        Matcher matcher = SUB_VARIABLE.matcher(subTemplate);
        while (matcher.find()) {
            String expression = matcher.group(1);
            if (expression.startsWith("!")) {
                continue;
            }
            int dot = expression.indexOf('.');
            String name = dot >= 0 ? expression.substring(0, dot) : expression;
            if (name.isEmpty() || PseudoParameter.isReserved(name) || boundVariables.containsKey(name)) {
                continue;
            }
            sink.accept(name);
        }
    }

    private static final class ReferenceCollector implements IrValueVisitor<Void> {

        private final Consumer<String> edgeSink;

        ReferenceCollector(Consumer<String> edgeSink) {
            this.edgeSink = edgeSink;
        }

        @Override
        public Void visitScalar(IrScalar scalar) {
            return null;
        }

        @Override
        public Void visitList(IrList list) {
            list.getItems().forEach(item -> item.accept(this));
            return null;
        }

        @Override
        public Void visitMap(IrMap map) {
            map.getEntries().values().forEach(value -> value.accept(this));
            return null;
        }

        @Override
        public Void visitIntrinsic(Intrinsic intrinsic) {
            switch (intrinsic.getKind()) {
                case REF -> {
                    String target = intrinsic.getTarget();
                    if (target != null && !PseudoParameter.isReserved(target)) {
                        edgeSink.accept(target);
                    }
                }
                case GET_ATT -> edgeSink.accept(intrinsic.getTarget());
                case SUB -> collectSubReferences(intrinsic.getSubTemplate(), intrinsic.getSubVariables(),
                        edgeSink);
                default -> {
                    // other kinds only reference through their arguments
                }
            }
            IrValue args = intrinsic.getArgs();
            args.accept(this);
            return null;
        }
    }
}
