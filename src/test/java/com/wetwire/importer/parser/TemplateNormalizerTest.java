package com.wetwire.importer.parser;

import com.wetwire.importer.diagnostics.ToolDiagnostics;
import com.wetwire.importer.model.Intrinsic;
import com.wetwire.importer.model.IntrinsicKind;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.model.Parameter;
import com.wetwire.importer.model.Resource;
import com.wetwire.importer.model.Template;
import com.wetwire.importer.parser.tree.TreeMapping;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TemplateNormalizer and ValueNormalizer.
 */
class TemplateNormalizerTest {

    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    @Test
    void testShortAndLongFormProduceEqualResources() {
        String shortForm = """
            Resources:
              Function:
                Type: AWS::Lambda::Function
                Properties:
                  Role: !GetAtt Role.Arn
                  FunctionName: !Sub "${AWS::StackName}-fn"
                  Handler: !Join ["", [!Ref Prefix, ".handler"]]
                  Runtime: !If [IsProd, python3.12, !Ref AWS::NoValue]
                  Layers: !Split [",", !ImportValue SharedLayers]
                  Zone: !Select [0, !GetAZs ""]
            """;
        String longForm = """
            {
              "Resources": {
                "Function": {
                  "Type": "AWS::Lambda::Function",
                  "Properties": {
                    "Role": {"Fn::GetAtt": ["Role", "Arn"]},
                    "FunctionName": {"Fn::Sub": "${AWS::StackName}-fn"},
                    "Handler": {"Fn::Join": ["", [{"Ref": "Prefix"}, ".handler"]]},
                    "Runtime": {"Fn::If": ["IsProd", "python3.12", {"Ref": "AWS::NoValue"}]},
                    "Layers": {"Fn::Split": [",", {"Fn::ImportValue": "SharedLayers"}]},
                    "Zone": {"Fn::Select": [0, {"Fn::GetAZs": ""}]}
                  }
                }
              }
            }
            """;

        Template fromYaml = normalize(shortForm);
        Template fromJson = normalize(longForm);

        assertThat(fromYaml.getResources()).isEqualTo(fromJson.getResources());
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testGetAttDottedAndListFormsAreEqual() {
        String yaml = """
            Resources:
              A:
                Type: AWS::SNS::Topic
                Properties:
                  Dotted: !GetAtt Queue.Arn
                  Listed: !GetAtt [Queue, Arn]
            """;

        Resource resource = normalize(yaml).getResources().get("A");

        Intrinsic dotted = (Intrinsic) resource.getProperties().get("Dotted");
        assertThat(dotted.getKind()).isEqualTo(IntrinsicKind.GET_ATT);
        assertThat(dotted.getTarget()).isEqualTo("Queue");
        assertThat(dotted.getAttribute()).isEqualTo("Arn");
        assertThat(resource.getProperties().get("Listed")).isEqualTo(dotted);
    }

    @Test
    void testSubWithVariableMap() {
        String yaml = """
            Resources:
              A:
                Type: AWS::SNS::Topic
                Properties:
                  TopicName: !Sub
                    - "${Prefix}-${Suffix}"
                    - Suffix: topic
            """;

        Intrinsic sub = (Intrinsic) normalize(yaml).getResources().get("A").getProperties().get("TopicName");

        assertThat(sub.getSubTemplate()).isEqualTo("${Prefix}-${Suffix}");
        assertThat(sub.getSubVariables().getEntries()).containsOnlyKeys("Suffix");
    }

    @Test
    void testSectionsAreRead() {
        String yaml = """
            AWSTemplateFormatVersion: "2010-09-09"
            Description: Sample stack
            Parameters:
              Env:
                Type: String
                Default: dev
                AllowedValues: [dev, prod]
                Description: Deployment environment
            Mappings:
              RegionMap:
                us-east-1:
                  Ami: ami-123
                NotAMap: dropped
            Conditions:
              IsProd: !Equals [!Ref Env, prod]
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
                DependsOn: Other
                Condition: IsProd
                DeletionPolicy: Retain
                Metadata:
                  Owner: team
              Other:
                Type: AWS::S3::Bucket
                DependsOn: [Bucket]
            Outputs:
              BucketName:
                Value: !Ref Bucket
                Description: The bucket
                Export:
                  Name: !Sub "${AWS::StackName}-bucket"
                Condition: IsProd
            """;

        Template template = normalize(yaml);

        assertThat(template.getDescription()).isEqualTo("Sample stack");
        assertThat(template.getFormatVersion()).isEqualTo("2010-09-09");

        Parameter env = template.getParameters().get("Env");
        assertThat(env.getType()).isEqualTo("String");
        assertThat(env.getDefaultValue()).isEqualTo(IrScalar.string("dev"));
        assertThat(env.getAllowedValues()).containsExactly(IrScalar.string("dev"), IrScalar.string("prod"));
        assertThat(env.getDescription()).isEqualTo("Deployment environment");

        assertThat(template.getMappings().get("RegionMap").getEntries()).containsOnlyKeys("us-east-1");

        Intrinsic isProd = (Intrinsic) template.getConditions().get("IsProd").getExpression();
        assertThat(isProd.getKind()).isEqualTo(IntrinsicKind.EQUALS);

        Resource bucket = template.getResources().get("Bucket");
        assertThat(bucket.getDependsOn()).containsExactly("Other");
        assertThat(bucket.getCondition()).isEqualTo("IsProd");
        assertThat(bucket.getDeletionPolicy()).isEqualTo("Retain");
        assertThat(bucket.getMetadata().get("Owner")).isEqualTo(IrScalar.string("team"));
        assertThat(template.getResources().get("Other").getDependsOn()).containsExactly("Bucket");

        assertThat(template.getOutputs().get("BucketName").getExportName()).isInstanceOf(Intrinsic.class);
        assertThat(template.getOutputs().get("BucketName").getCondition()).isEqualTo("IsProd");
    }

    @Test
    void testResourceConditionAttributeIsNotAnIntrinsic() {
        String yaml = """
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
                Condition: IsProd
            """;

        Resource bucket = normalize(yaml).getResources().get("Bucket");

        assertThat(bucket.getCondition()).isEqualTo("IsProd");
        assertThat(bucket.getProperties()).isEmpty();
    }

    @Test
    void testSectionsKeepSourceOrder() {
        String yaml = """
            Resources:
              Zeta:
                Type: AWS::S3::Bucket
              Alpha:
                Type: AWS::S3::Bucket
              Mid:
                Type: AWS::S3::Bucket
            """;

        assertThat(normalize(yaml).getResources().keySet()).containsExactly("Zeta", "Alpha", "Mid");
    }

    @Test
    void testUnknownTagWarnsAndFallsBackToLiteral() {
        String yaml = """
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
                Properties:
                  BucketName: !Frobnicate data
                  Tags: !Frobnicate [a, b]
            """;

        Resource bucket = normalize(yaml).getResources().get("Bucket");

        assertThat(bucket.getProperties().get("BucketName")).isEqualTo(IrScalar.string("data"));
        assertThat(bucket.getProperties().get("Tags")).isEqualTo(IrScalar.NULL);
        assertThat(diagnostics.getWarnings()).hasSize(2);
        assertThat(diagnostics.getWarnings().get(0)).contains("!Frobnicate");
    }

    @Test
    void testMalformedLongFormStaysAMap() {
        String yaml = """
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
                Properties:
                  BucketName:
                    Fn::Join: only-one-argument
            """;

        IrValue value = normalize(yaml).getResources().get("Bucket").getProperties().get("BucketName");

        assertThat(value).isInstanceOf(IrMap.class);
        assertThat(((IrMap) value).get("Fn::Join")).isEqualTo(IrScalar.string("only-one-argument"));
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("Fn::Join"));
    }

    @Test
    void testMapWithExtraKeysIsNotAnIntrinsic() {
        String yaml = """
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
                Properties:
                  Config:
                    Ref: Other
                    Extra: true
            """;

        IrValue value = normalize(yaml).getResources().get("Bucket").getProperties().get("Config");

        assertThat(value).isInstanceOf(IrMap.class);
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testForEachLoopsAreSkipped() {
        String yaml = """
            Transform: AWS::LanguageExtensions
            Resources:
              Fn::ForEach::Buckets:
                - Name
                - [a, b]
                - Bucket${Name}:
                    Type: AWS::S3::Bucket
              Plain:
                Type: AWS::S3::Bucket
            """;

        Template template = normalize(yaml);

        assertThat(template.getResources()).containsOnlyKeys("Plain");
    }

    @Test
    void testResourceWithoutTypeIsSkippedWithWarning() {
        String yaml = """
            Resources:
              Broken:
                Properties:
                  Name: x
              Fine:
                Type: AWS::SNS::Topic
            """;

        Template template = normalize(yaml);

        assertThat(template.getResources()).containsOnlyKeys("Fine");
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("Broken"));
    }

    @Test
    void testNotAcceptsBareOperand() {
        String yaml = """
            Conditions:
              IsDev: !Not [!Condition IsProd]
              IsDevToo:
                Fn::Not:
                  - Condition: IsProd
            """;

        Template template = normalize(yaml);

        Intrinsic not = (Intrinsic) template.getConditions().get("IsDev").getExpression();
        assertThat(not.getKind()).isEqualTo(IntrinsicKind.NOT);
        assertThat(((Intrinsic) not.getArgs()).getKind()).isEqualTo(IntrinsicKind.CONDITION);
        assertThat(template.getConditions().get("IsDevToo").getExpression()).isEqualTo(not);
    }

    @Test
    void testListsKeepOrder() {
        String yaml = """
            Resources:
              A:
                Type: AWS::SNS::Topic
                Properties:
                  Items: [3, 1, 2]
            """;

        IrList items = (IrList) normalize(yaml).getResources().get("A").getProperties().get("Items");

        assertThat(items.getItems()).containsExactly(IrScalar.of(3L), IrScalar.of(1L), IrScalar.of(2L));
    }

    private Template normalize(String text) {
        TreeMapping root = new TemplateDecoder().decode(text.getBytes(StandardCharsets.UTF_8), "test.yaml");
        return new TemplateNormalizer(diagnostics).normalize(root, "test.yaml");
    }
}
