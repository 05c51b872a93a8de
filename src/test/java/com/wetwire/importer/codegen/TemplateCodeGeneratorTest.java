package com.wetwire.importer.codegen;

import com.wetwire.importer.codegen.context.GeneratorConfig;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the generated source of single templates.
 */
class TemplateCodeGeneratorTest {

    private static final String SOURCE_PATH = "my_stack/MyStack.java";

    @Test
    void testDirectReferenceOrdersTargetFirst() {
        String yaml = """
            Resources:
              Alpha:
                Type: AWS::S3::BucketPolicy
                Properties:
                  Bucket: !Ref Zeta
              Zeta:
                Type: AWS::S3::Bucket
            """;

        String source = generate(yaml);

        assertThat(source).isEqualTo("""
                // Generated by cfn-template-importer from stack.yaml. Do not edit.
                package my_stack;

                import dev.wetwire.aws.resources.s3.Bucket;
                import dev.wetwire.aws.resources.s3.BucketPolicy;

                /**
                 * Resources imported from stack.yaml.
                 */
                public final class MyStack {

                    private MyStack() {
                    }

                    public static final Bucket Zeta = Bucket.builder().build();

                    public static final BucketPolicy Alpha = BucketPolicy.builder()
                            .bucket(Zeta)
                            .build();
                }
                """);
    }

    @Test
    void testAttributeReferenceUsesDottedAccess() {
        String yaml = """
            Resources:
              Handler:
                Type: AWS::Lambda::Function
                Properties:
                  Role: !GetAtt ExecutionRole.Arn
              ExecutionRole:
                Type: AWS::IAM::Role
            """;

        String source = generate(yaml);

        assertThat(source).contains(".role(ExecutionRole.Arn)");
        assertThat(source).doesNotContain("getAtt(");
        assertThat(source.indexOf("Role ExecutionRole =")).isLessThan(source.indexOf("Function Handler ="));
    }

    @Test
    void testDottedAttributeAndUnknownTargetsUseHelperCalls() {
        String yaml = """
            Resources:
              Db:
                Type: AWS::RDS::DBInstance
              Param:
                Type: AWS::SSM::Parameter
                Properties:
                  Value: !GetAtt Db.Endpoint.Address
                  Description: !Ref SomewhereElse
                  Name: !GetAtt Elsewhere.Arn
            """;

        String source = generate(yaml);

        assertThat(source).contains(".value(getAtt(\"Db\", \"Endpoint.Address\"))");
        assertThat(source).contains(".description(ref(\"SomewhereElse\"))");
        assertThat(source).contains(".name(getAtt(\"Elsewhere\", \"Arn\"))");
        assertThat(source).contains("import static dev.wetwire.aws.intrinsics.Intrinsics.*;");
    }

    @Test
    void testSubReferenceDeclaresOnlyUsedParameters() {
        String yaml = """
            Parameters:
              Env:
                Type: String
                Description: Deployment environment
              Unused:
                Type: String
            Resources:
              Data:
                Type: AWS::S3::Bucket
                Properties:
                  BucketName: !Sub "${Env}-suffix"
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                    // Env - Deployment environment
                    public static final Parameter Env = param("Env");
                """);
        assertThat(source).contains(".bucketName(sub(\"${Env}-suffix\"))");
        assertThat(source).doesNotContain("Unused");
        assertThat(source).contains("import dev.wetwire.aws.intrinsics.Parameter;");
        assertThat(source.indexOf("Parameter Env")).isLessThan(source.indexOf("Bucket Data"));
    }

    @Test
    void testBlockWorthyElementsBecomeNamedDeclarations() {
        String yaml = """
            Resources:
              WebSg:
                Type: AWS::EC2::SecurityGroup
                Properties:
                  GroupDescription: web
                  SecurityGroupIngress:
                    - IpProtocol: tcp
                      FromPort: 80
                      ToPort: 80
                      CidrIp: 0.0.0.0/0
                    - IpProtocol: tcp
                      FromPort: 443
                      ToPort: 443
                      CidrIp: 0.0.0.0/0
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                    public static final SecurityGroup.Ingress WebSgPort80 = SecurityGroup.Ingress.builder()
                            .cidrIp("0.0.0.0/0")
                            .fromPort(80)
                            .ipProtocol("tcp")
                            .toPort(80)
                            .build();
                """);
        assertThat(source).contains("SecurityGroup.Ingress WebSgPort443 =");
        assertThat(source).contains(".securityGroupIngress(List.of(WebSgPort80, WebSgPort443))");
        assertThat(source.indexOf("WebSgPort443 =")).isLessThan(source.indexOf("SecurityGroup WebSg ="));
        assertThat(source).contains("import java.util.List;");
    }

    @Test
    void testBlockNamesForRangesProtocolsAndFallbacks() {
        String yaml = """
            Resources:
              WebSg:
                Type: AWS::EC2::SecurityGroup
                Properties:
                  SecurityGroupEgress:
                    - IpProtocol: "-1"
                      CidrIp: 0.0.0.0/0
                    - IpProtocol: udp
                      FromPort: 1000
                      ToPort: 2000
                      CidrIp: 10.0.0.0/8
                    - IpProtocol: "-1"
                      FromPort: -1
                      ToPort: -1
                      CidrIp: 10.0.0.0/8
            """;

        String source = generate(yaml);

        assertThat(source).contains("SecurityGroup.Egress WebSg1 =");
        assertThat(source).contains("SecurityGroup.Egress WebSgPorts1000To2000UDP =");
        assertThat(source).contains("SecurityGroup.Egress WebSgPortAllAll =");
    }

    @Test
    void testCycleMembersAreAllEmitted() {
        String yaml = """
            Resources:
              Beta:
                Type: AWS::SNS::Topic
                Properties:
                  Peer: !Ref Alpha
              Alpha:
                Type: AWS::SNS::Topic
                Properties:
                  Peer: !Ref Beta
            """;

        String source = generate(yaml);

        assertThat(source).contains("Topic Alpha =", "Topic Beta =");
        assertThat(source.indexOf("Topic Alpha =")).isLessThan(source.indexOf("Topic Beta ="));
    }

    @Test
    void testTagsAreExtracted() {
        String yaml = """
            Parameters:
              Env:
                Type: String
            Resources:
              Data:
                Type: AWS::S3::Bucket
                Properties:
                  Tags:
                    - Key: Name
                      Value: web
                    - Key: env
                      Value: !Ref Env
                    - Key: Name
                      Value: duplicate
            """;

        String source = generate(yaml);

        assertThat(source).contains("    public static final Tag DataTagName = Tag.of(\"Name\", \"web\");");
        assertThat(source).contains("    public static final Tag DataTagEnv = Tag.of(\"env\", Env);");
        assertThat(source).contains("    public static final Tag DataTagName1 = Tag.of(\"Name\", \"duplicate\");");
        assertThat(source).contains(".tags(List.of(DataTagName, DataTagEnv, DataTagName1))");
        assertThat(source).contains("public static final Parameter Env = param(\"Env\");");
    }

    @Test
    void testUnknownResourceTypeIsGeneric() {
        String yaml = """
            Resources:
              Provisioner:
                Type: Custom::Thing
                Properties:
                  ServiceToken: arn:aws:lambda:us-east-1:123456789012:function:x
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                    // Unknown resource type: Custom::Thing
                    public static final GenericResource Provisioner = GenericResource.builder("Custom::Thing")
                            .property("ServiceToken", "arn:aws:lambda:us-east-1:123456789012:function:x")
                            .build();
                """);
    }

    @Test
    void testNestedMapsTypedOrUntyped() {
        String yaml = """
            Resources:
              Data:
                Type: AWS::S3::Bucket
                Properties:
                  VersioningConfiguration:
                    Status: Enabled
              Role:
                Type: AWS::IAM::Role
                Properties:
                  AssumeRolePolicyDocument:
                    Version: "2012-10-17"
                    Statement:
                      - Effect: Allow
                        Action: sts:AssumeRole
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                            .versioningConfiguration(Bucket.VersioningConfiguration.builder()
                                    .status("Enabled")
                                    .build())
                """);
        assertThat(source).contains(".assumeRolePolicyDocument(Map.ofEntries(");
        assertThat(source).contains("Map.entry(\"Version\", \"2012-10-17\")");
        assertThat(source).contains("Map.entry(\"Effect\", \"Allow\")");
        assertThat(source).doesNotContain("AssumeRolePolicyDocument.builder()");
    }

    @Test
    void testDeeplyNestedTypesBelongToTheResource() {
        String yaml = """
            Resources:
              Cdn:
                Type: AWS::CloudFront::Distribution
                Properties:
                  DistributionConfig:
                    DefaultCacheBehavior:
                      TargetOriginId: origin
            """;

        String source = generate(yaml);

        assertThat(source).contains(".distributionConfig(Distribution.DistributionConfig.builder()");
        assertThat(source).contains(".defaultCacheBehavior(Distribution.DefaultCacheBehavior.builder()");
        assertThat(source).doesNotContain("DistributionConfig.DefaultCacheBehavior");
    }

    @Test
    void testNonIdentifierKeysStayUntyped() {
        String yaml = """
            Resources:
              Fn:
                Type: AWS::Lambda::Function
                Properties:
                  Environment:
                    Variables:
                      my-var: value
                  Config:
                    some-key: 1
            """;

        String source = generate(yaml);

        assertThat(source).contains("Function.Environment.builder()");
        assertThat(source).contains("Map.entry(\"my-var\", \"value\")");
        assertThat(source).contains(".config(Map.of");
    }

    @Test
    void testPseudoParametersRenderAsConstants() {
        String yaml = """
            Resources:
              Data:
                Type: AWS::S3::Bucket
                Properties:
                  BucketName: !Ref AWS::StackName
                  Region: AWS::Region
                  Other: !Ref AWS::Unlisted
            """;

        String source = generate(yaml);

        assertThat(source).contains(".bucketName(AWS_STACK_NAME)");
        assertThat(source).contains(".region(AWS_REGION)");
        assertThat(source).contains(".other(ref(\"AWS::Unlisted\"))");
    }

    @Test
    void testIntrinsicHelpers() {
        String yaml = """
            Conditions:
              IsProd: !Equals [!Ref AWS::Region, us-east-1]
            Resources:
              Data:
                Type: AWS::S3::Bucket
                Properties:
                  A: !If [IsProd, yes-value, !Ref AWS::NoValue]
                  B: !Join ["-", [a, b]]
                  C: !Select [0, !GetAZs ""]
                  D: !Base64 text
                  E: !FindInMap [RegionMap, !Ref AWS::Region, Ami]
                  F: !ImportValue shared-vpc
                  G: !Sub
                    - "${Name}-x"
                    - Name: n
                  H: !Cidr ["10.0.0.0/16", 4, 8]
                  I: !Split [",", "a,b"]
            """;

        String source = generate(yaml);

        assertThat(source).contains("public static final Intrinsic IsProdCondition = fnEquals(AWS_REGION, \"us-east-1\");");
        assertThat(source).contains(".a(fnIf(\"IsProd\", \"yes-value\", AWS_NO_VALUE))");
        assertThat(source).contains(".b(join(\"-\", List.of(\"a\", \"b\")))");
        assertThat(source).contains(".c(select(0, getAZs()))");
        assertThat(source).contains(".d(base64(\"text\"))");
        assertThat(source).contains(".e(findInMap(\"RegionMap\", AWS_REGION, \"Ami\"))");
        assertThat(source).contains(".f(importValue(\"shared-vpc\"))");
        assertThat(source).contains(".g(subWithMap(\"${Name}-x\", Map.ofEntries(Map.entry(\"Name\", \"n\"))))");
        assertThat(source).contains(".h(cidr(\"10.0.0.0/16\", 4, 8))");
        assertThat(source).contains(".i(split(\",\", \"a,b\"))");
    }

    @Test
    void testMappingsConditionsAndOutputs() {
        String yaml = """
            Mappings:
              RegionMap:
                us-east-1:
                  Ami: ami-123
            Conditions:
              HasBucket: !Not [!Equals ["", x]]
            Resources:
              Data:
                Type: AWS::S3::Bucket
            Outputs:
              BucketArn:
                Value: !GetAtt Data.Arn
                Description: The bucket ARN
                Export:
                  Name: !Sub "${AWS::StackName}-arn"
                Condition: HasBucket
            """;

        String source = generate(yaml);

        assertThat(source).contains("public static final Map<String, Object> RegionMapMapping = Map.ofEntries(");
        assertThat(source).contains("Map.entry(\"Ami\", \"ami-123\")");
        assertThat(source).contains("public static final Intrinsic HasBucketCondition = not(fnEquals(\"\", \"x\"));");
        assertThat(source).contains("""
                    public static final Output BucketArnOutput = Output.builder()
                            .value(Data.Arn)
                            .description("The bucket ARN")
                            .exportName(sub("${AWS::StackName}-arn"))
                            .condition("HasBucket")
                            .build();
                """);
        assertThat(source.indexOf("RegionMapMapping")).isLessThan(source.indexOf("HasBucketCondition"));
        assertThat(source.indexOf("HasBucketCondition")).isLessThan(source.indexOf("Bucket Data"));
        assertThat(source.indexOf("Bucket Data")).isLessThan(source.indexOf("BucketArnOutput"));
    }

    @Test
    void testResourceAttributes() {
        String yaml = """
            Resources:
              Data:
                Type: AWS::S3::Bucket
                DependsOn: [Logs, External]
                Condition: IsProd
                DeletionPolicy: Retain
                UpdateReplacePolicy: Snapshot
              Logs:
                Type: AWS::Logs::LogGroup
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                    public static final Bucket Data = Bucket.builder()
                            .dependsOn(Logs, "External")
                            .condition("IsProd")
                            .deletionPolicy("Retain")
                            .updateReplacePolicy("Snapshot")
                            .build();
                """);
        assertThat(source.indexOf("LogGroup Logs =")).isLessThan(source.indexOf("Bucket Data ="));
    }

    @Test
    void testLongArgumentListsWrap() {
        String yaml = """
            Resources:
              Data:
                Type: AWS::S3::Bucket
                Properties:
                  BucketName: !Join ["-", [first-very-long-segment, second-very-long-segment, third-very-long-segment]]
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                            .bucketName(join(
                                    "-",
                                    List.of(
                                            "first-very-long-segment",
                                            "second-very-long-segment",
                                            "third-very-long-segment")))
                """);
    }

    @Test
    void testNumbersAndEscapes() {
        String yaml = """
            Resources:
              Data:
                Type: AWS::SQS::Queue
                Properties:
                  Delay: 30
                  Huge: 9999999999
                  Ratio: 1.5
                  Fifo: true
                  Nothing: null
                  Text: "quote \\" and backslash \\\\ and\\nnewline"
            """;

        String source = generate(yaml);

        assertThat(source).contains(".delay(30)");
        assertThat(source).contains(".huge(9999999999L)");
        assertThat(source).contains(".ratio(1.5)");
        assertThat(source).contains(".fifo(true)");
        assertThat(source).contains(".nothing(null)");
        assertThat(source).contains(".text(\"quote \\\" and backslash \\\\ and\\nnewline\")");
    }

    @Test
    void testIdentifierCollisionsFallBackToQualifiedNames() {
        String yaml = """
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
              Topic:
                Type: AWS::SNS::Topic
                Properties:
                  Target: !Ref Bucket
            """;

        String source = generate(yaml);

        assertThat(source).contains("public static final dev.wetwire.aws.resources.s3.Bucket Bucket = "
                + "dev.wetwire.aws.resources.s3.Bucket.builder().build();");
        assertThat(source).doesNotContain("import dev.wetwire.aws.resources.s3.Bucket;");
        assertThat(source).contains(".target(Bucket)");
    }

    @Test
    void testMemberNamesAreUniqueAcrossSections() {
        String yaml = """
            Conditions:
              Prod: !Equals [a, b]
            Resources:
              ProdCondition:
                Type: AWS::SNS::Topic
              My-Queue:
                Type: AWS::SQS::Queue
              MyQueue:
                Type: AWS::SQS::Queue
            """;

        String source = generate(yaml);

        assertThat(source).contains("public static final Topic ProdCondition = Topic.builder().build();");
        assertThat(source).contains("public static final Intrinsic ProdCondition1 = fnEquals(\"a\", \"b\");");
        assertThat(source).contains("public static final Queue MyQueue = Queue.builder().build();");
        assertThat(source).contains("public static final Queue MyQueue1 = Queue.builder().build();");
    }

    @Test
    void testDescriptionBecomesClassJavadoc() {
        String yaml = """
            Description: |
              Network stack.
              Creates the VPC.
            Resources: {}
            """;

        String source = generate(yaml);

        assertThat(source).contains("""
                /**
                 * Resources imported from stack.yaml.
                 *
                 * Network stack.
                 * Creates the VPC.
                 */
                """);
    }

    private String generate(String yaml) {
        GeneratorConfig config = GeneratorConfig.builder()
                .packageName("my_stack")
                .className("MyStack")
                .build();
        ImportResult result = new TemplateImporter(config)
                .importTemplate(yaml.getBytes(StandardCharsets.UTF_8), "stack.yaml");
        assertThat(result.getFiles()).containsOnlyKeys(SOURCE_PATH);
        return result.getFiles().get(SOURCE_PATH);
    }
}
