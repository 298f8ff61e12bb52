package com.enterprise.securedb.param;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ParamsTest {

    @Test
    void skipControlBecomesSkipVariant() {
        assertThat(Params.of(MacroControl.SKIP)).isEqualTo(Param.skip());
        assertThat(Params.of(MacroControl.SKIP).isSkip()).isTrue();
    }

    @Test
    void skipVariantsAreStructurallyEqual() {
        assertThat(new Param.Skip()).isEqualTo(Param.skip());
        assertThat(Param.skip()).isNotEqualTo(new Param.Scalar(null));
    }

    @Test
    void nullIsAScalarNotASkip() {
        Param p = Params.of(null);
        assertThat(p).isEqualTo(new Param.Scalar(null));
        assertThat(p.isSkip()).isFalse();
    }

    @Test
    void listsAndArraysBecomeSequences() {
        assertThat(Params.of(List.of(1, 2))).isEqualTo(new Param.Sequence(
                List.of(new Param.Scalar(1), new Param.Scalar(2))));
        assertThat(Params.of(new int[] {7, 8})).isEqualTo(new Param.Sequence(
                List.of(new Param.Scalar(7), new Param.Scalar(8))));
    }

    @Test
    void byteArrayStaysScalar() {
        byte[] blob = {1, 2, 3};
        assertThat(Params.of(blob)).isInstanceOf(Param.Scalar.class);
    }

    @Test
    void wrapperBecomesExtractable() {
        NativeExtractable wrapper = () -> 42;
        assertThat(Params.of(wrapper)).isEqualTo(new Param.Extractable(wrapper));
        assertThat(Params.unwrap(wrapper)).isEqualTo(42);
        assertThat(Params.unwrap("plain")).isEqualTo("plain");
    }

    @Test
    void existingParamIsKept() {
        Param p = new Param.Scalar("x");
        assertThat(Params.of(p)).isSameAs(p);
    }

    @Test
    void nullVarargsArrayIsOneNullParameter() {
        assertThat(Params.list((Object[]) null)).containsExactly(new Param.Scalar(null));
    }

    @Test
    void denseIntegerKeysAreNotAssociative() {
        Map<Integer, String> dense = new LinkedHashMap<>();
        dense.put(0, "a");
        dense.put(1, "b");
        assertThat(((Param.Mapping) Params.of(dense)).isAssociative()).isFalse();
    }

    @Test
    void outOfOrderOrSparseKeysAreAssociative() {
        Map<Integer, String> reordered = new LinkedHashMap<>();
        reordered.put(1, "b");
        reordered.put(0, "a");
        assertThat(((Param.Mapping) Params.of(reordered)).isAssociative()).isTrue();

        Map<Integer, String> sparse = new LinkedHashMap<>();
        sparse.put(0, "a");
        sparse.put(2, "c");
        assertThat(((Param.Mapping) Params.of(sparse)).isAssociative()).isTrue();

        assertThat(((Param.Mapping) Params.of(Map.of("name", "x"))).isAssociative()).isTrue();
    }
}
