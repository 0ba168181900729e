package com.example.catalog.tree;

import com.example.catalog.IndexOutOfRangeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SliceTest {

    @Test
    void resolvesLikeSequenceSlicing() {
        assertThat(Slice.all().resolve(5)).isEqualTo(new Slice.Bounds(0, 5));
        assertThat(Slice.of(1, 3).resolve(5)).isEqualTo(new Slice.Bounds(1, 3));
        assertThat(Slice.from(-2).resolve(5)).isEqualTo(new Slice.Bounds(3, 5));
        assertThat(Slice.to(-1).resolve(5)).isEqualTo(new Slice.Bounds(0, 4));
        assertThat(Slice.of(-10, 10).resolve(5)).isEqualTo(new Slice.Bounds(0, 5));
        assertThat(Slice.of(4, 2).resolve(5).length()).isZero();
    }

    @Test
    void skipAndLimitForForwardSlices() {
        assertThat(Slice.all().isRelativeToEnd()).isFalse();
        assertThat(Slice.all().limit()).isNull();
        assertThat(Slice.of(2, 5).skip()).isEqualTo(2);
        assertThat(Slice.of(2, 5).limit()).isEqualTo(3L);
        assertThat(Slice.of(5, 2).limit()).isZero();
        assertThat(Slice.from(-1).isRelativeToEnd()).isTrue();
    }

    @Test
    void singleIndex() {
        assertThat(Slice.index(0, 3)).isZero();
        assertThat(Slice.index(-1, 3)).isEqualTo(2);
        assertThatThrownBy(() -> Slice.index(3, 3)).isInstanceOf(IndexOutOfRangeException.class);
        assertThatThrownBy(() -> Slice.index(-4, 3)).isInstanceOf(IndexOutOfRangeException.class);
        assertThatThrownBy(() -> Slice.index(0, 0)).isInstanceOf(IndexOutOfRangeException.class);
    }
}
