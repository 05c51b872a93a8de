package com.wetwire.importer.analysis;

import com.wetwire.importer.model.IntrinsicFactory;
import com.wetwire.importer.model.IntrinsicKind;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.Output;
import com.wetwire.importer.model.Parameter;
import com.wetwire.importer.model.Resource;
import com.wetwire.importer.model.Template;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ReferenceAnalyzer and ReferenceGraph.
 */
class ReferenceAnalyzerTest {

    private final ReferenceAnalyzer analyzer = new ReferenceAnalyzer();

    @Test
    void testRefAndGetAttCreateEdges() {
        Template template = Template.builder()
                .resource("Role", resource("Role", "AWS::IAM::Role").build())
                .resource("Function", resource("Function", "AWS::Lambda::Function")
                        .property("Role", IntrinsicFactory.getAtt("Role", "Arn"))
                        .property("Environment", new IrMap(Map.of(
                                "Variables", new IrMap(Map.of("TABLE", IntrinsicFactory.ref("Table"))))))
                        .build())
                .build();

        ReferenceGraph graph = analyzer.analyze(template);

        assertThat(graph.dependenciesOf("Function")).containsExactly("Role", "Table");
        assertThat(graph.dependenciesOf("Role")).isEmpty();
        assertThat(graph.getEdges()).containsOnlyKeys("Function", "Role");
    }

    @Test
    void testPseudoParametersAreNotEdges() {
        Template template = Template.builder()
                .resource("Bucket", resource("Bucket", "AWS::S3::Bucket")
                        .property("BucketName", IntrinsicFactory.ref("AWS::Region"))
                        .build())
                .build();

        ReferenceGraph graph = analyzer.analyze(template);

        assertThat(graph.dependenciesOf("Bucket")).isEmpty();
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void testSubInterpolationCreatesEdges() {
        Template template = Template.builder()
                .parameter("Env", Parameter.builder().logicalId("Env").build())
                .resource("Bucket", resource("Bucket", "AWS::S3::Bucket")
                        .property("BucketName", IntrinsicFactory.sub("${Env}-suffix"))
                        .build())
                .build();

        ReferenceGraph graph = analyzer.analyze(template);

        assertThat(graph.hasEdge("Bucket", "Env")).isTrue();
        assertThat(graph.isReferenced("Env")).isTrue();
    }

    @Test
    void testSubSkipsLiteralsPseudoParametersAndBoundVariables() {
        IrList args = IrList.of(
                IrScalar.string("${AWS::Region}-${!Literal}-${Queue.Arn}-${Local}"),
                new IrMap(Map.of("Local", IrScalar.string("x"))));
        Template template = Template.builder()
                .resource("Topic", resource("Topic", "AWS::SNS::Topic")
                        .property("TopicName", IntrinsicFactory.create(IntrinsicKind.SUB, args).orElseThrow())
                        .build())
                .build();

        ReferenceGraph graph = analyzer.analyze(template);

        assertThat(graph.dependenciesOf("Topic")).containsExactly("Queue");
    }

    @Test
    void testSubVariableValuesAreWalked() {
        IrList args = IrList.of(
                IrScalar.string("${Name}"),
                new IrMap(Map.of("Name", IntrinsicFactory.ref("Bucket"))));
        Template template = Template.builder()
                .resource("Topic", resource("Topic", "AWS::SNS::Topic")
                        .property("TopicName", IntrinsicFactory.create(IntrinsicKind.SUB, args).orElseThrow())
                        .build())
                .build();

        assertThat(analyzer.analyze(template).dependenciesOf("Topic")).containsExactly("Bucket");
    }

    @Test
    void testCollectSubReferences() {
        List<String> names = new ArrayList<>();

        ReferenceAnalyzer.collectSubReferences("${A}/${B.Arn}/${A}/${AWS::StackName}", IrMap.EMPTY, names::add);

        assertThat(names).containsExactly("A", "B", "A");
    }

    @Test
    void testOutputValuesAreWalkedButNotExportNames() {
        Template template = Template.builder()
                .resource("Bucket", resource("Bucket", "AWS::S3::Bucket").build())
                .output("BucketArn", Output.builder()
                        .logicalId("BucketArn")
                        .value(IntrinsicFactory.getAtt("Bucket", "Arn"))
                        .exportName(IntrinsicFactory.ref("ExportPrefix"))
                        .build())
                .build();

        ReferenceGraph graph = analyzer.analyze(template);

        assertThat(graph.outputDependenciesOf("BucketArn")).containsExactly("Bucket");
        assertThat(graph.dependenciesOf("BucketArn")).isEmpty();
        assertThat(graph.isReferenced("ExportPrefix")).isFalse();
    }

    @Test
    void testOutputSharingResourceIdKeepsSeparateEdges() {
        Template template = Template.builder()
                .resource("Zed", resource("Zed", "AWS::S3::Bucket").build())
                .resource("Role", resource("Role", "AWS::IAM::Role")
                        .property("Path", IntrinsicFactory.ref("Zed"))
                        .build())
                .output("Zed", Output.builder()
                        .logicalId("Zed")
                        .value(IntrinsicFactory.getAtt("Role", "Arn"))
                        .build())
                .build();

        ReferenceGraph graph = analyzer.analyze(template);

        assertThat(graph.dependenciesOf("Zed")).isEmpty();
        assertThat(graph.dependenciesOf("Role")).containsExactly("Zed");
        assertThat(graph.outputDependenciesOf("Zed")).containsExactly("Role");
        assertThat(graph.isReferenced("Role")).isTrue();
    }

    @Test
    void testUndeclaredTargetsAreKept() {
        Template template = Template.builder()
                .resource("Bucket", resource("Bucket", "AWS::S3::Bucket")
                        .property("BucketName", IntrinsicFactory.ref("Missing"))
                        .build())
                .build();

        assertThat(analyzer.analyze(template).dependenciesOf("Bucket")).containsExactly("Missing");
    }

    static Resource.ResourceBuilder resource(String id, String type) {
        return Resource.builder().logicalId(id).type(type);
    }
}
