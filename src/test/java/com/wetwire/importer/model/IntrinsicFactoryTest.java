package com.wetwire.importer.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IntrinsicKind, ArgumentShape and IntrinsicFactory.
 */
class IntrinsicFactoryTest {

    @Test
    void testEveryKindIsReachableFromBothSyntaxes() {
        for (IntrinsicKind kind : IntrinsicKind.values()) {
            assertThat(IntrinsicKind.fromTag("!" + kind.getTagName())).contains(kind);
            assertThat(IntrinsicKind.fromLongFormKey(kind.getLongFormKey())).contains(kind);
        }
        assertThat(IntrinsicKind.values()).hasSize(19);
    }

    @Test
    void testLongFormKeys() {
        assertThat(IntrinsicKind.REF.getLongFormKey()).isEqualTo("Ref");
        assertThat(IntrinsicKind.CONDITION.getLongFormKey()).isEqualTo("Condition");
        assertThat(IntrinsicKind.GET_ATT.getLongFormKey()).isEqualTo("Fn::GetAtt");
        assertThat(IntrinsicKind.fromLongFormKey("Fn::Frobnicate")).isEmpty();
        assertThat(IntrinsicKind.fromTag("!Frobnicate")).isEmpty();
    }

    @Test
    void testRefRequiresAName() {
        assertThat(IntrinsicFactory.create(IntrinsicKind.REF, IrScalar.string("Bucket"))).isPresent();
        assertThat(IntrinsicFactory.create(IntrinsicKind.REF, IrList.of(IrScalar.string("Bucket")))).isEmpty();
        assertThat(IntrinsicFactory.create(IntrinsicKind.REF, null)).isEmpty();
    }

    @Test
    void testGetAttAcceptsDottedString() {
        Intrinsic getAtt = IntrinsicFactory.create(IntrinsicKind.GET_ATT, IrScalar.string("Db.Endpoint.Address"))
                .orElseThrow();

        assertThat(getAtt.getTarget()).isEqualTo("Db");
        assertThat(getAtt.getAttribute()).isEqualTo("Endpoint.Address");
        assertThat(getAtt).isEqualTo(IntrinsicFactory.getAtt("Db", "Endpoint.Address"));
    }

    @Test
    void testGetAttRejectsMalformedPaths() {
        assertThat(IntrinsicFactory.create(IntrinsicKind.GET_ATT, IrScalar.string("NoDot"))).isEmpty();
        assertThat(IntrinsicFactory.create(IntrinsicKind.GET_ATT, IrScalar.string(".Arn"))).isEmpty();
        assertThat(IntrinsicFactory.create(IntrinsicKind.GET_ATT, IrList.of(IrScalar.string("Only")))).isEmpty();
    }

    @Test
    void testSubForms() {
        Intrinsic plain = IntrinsicFactory.create(IntrinsicKind.SUB, IrScalar.string("${A}")).orElseThrow();
        Intrinsic single = IntrinsicFactory.create(IntrinsicKind.SUB, IrList.of(IrScalar.string("${A}"))).orElseThrow();
        Intrinsic withMap = IntrinsicFactory.create(IntrinsicKind.SUB, IrList.of(
                IrScalar.string("${A}"), new IrMap(Map.of("A", IrScalar.string("x"))))).orElseThrow();

        assertThat(single).isEqualTo(plain);
        assertThat(plain.getSubVariables().isEmpty()).isTrue();
        assertThat(withMap.getSubTemplate()).isEqualTo("${A}");
        assertThat(withMap.getSubVariables().get("A")).isEqualTo(IrScalar.string("x"));
        assertThat(IntrinsicFactory.create(IntrinsicKind.SUB, IrList.of(
                IrScalar.string("${A}"), IrScalar.string("not a map")))).isEmpty();
    }

    @Test
    void testListArityIsChecked() {
        IrList two = IrList.of(IrScalar.string(","), IrList.EMPTY);

        assertThat(IntrinsicFactory.create(IntrinsicKind.JOIN, two)).isPresent();
        assertThat(IntrinsicFactory.create(IntrinsicKind.JOIN, IrList.of(IrScalar.string(",")))).isEmpty();
        assertThat(IntrinsicFactory.create(IntrinsicKind.IF, two)).isEmpty();
        assertThat(IntrinsicFactory.create(IntrinsicKind.AND, IrList.EMPTY)).isPresent();
    }

    @Test
    void testExtraListArgumentsAreDropped() {
        IrList four = IrList.of(IrScalar.string("C"), IrScalar.of(1L), IrScalar.of(2L), IrScalar.of(3L));

        Intrinsic fnIf = IntrinsicFactory.create(IntrinsicKind.IF, four).orElseThrow();

        assertThat(fnIf.argList()).hasSize(3);
    }

    @Test
    void testGetAzsDefaultsToEmptyRegion() {
        Intrinsic empty = IntrinsicFactory.create(IntrinsicKind.GET_AZS, IrList.EMPTY).orElseThrow();
        Intrinsic nullArg = IntrinsicFactory.create(IntrinsicKind.GET_AZS, IrScalar.NULL).orElseThrow();

        assertThat(empty.getArgs()).isEqualTo(IrScalar.string(""));
        assertThat(nullArg.getArgs()).isEqualTo(IrScalar.string(""));
    }

    @Test
    void testPseudoParameters() {
        assertThat(PseudoParameter.fromTemplateName("AWS::Region")).contains(PseudoParameter.REGION);
        assertThat(PseudoParameter.REGION.getConstantName()).isEqualTo("AWS_REGION");
        assertThat(PseudoParameter.fromTemplateName("AWS::Unknown")).isEmpty();
        assertThat(PseudoParameter.isReserved("AWS::Unknown")).isTrue();
        assertThat(PseudoParameter.isReserved("Region")).isFalse();
    }
}
