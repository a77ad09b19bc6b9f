package com.delta.notifier.delivery;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchAssemblerTest {

    @Test
    void packsBlocksInOrderUpToCeiling() {
        List<String> batches = BatchAssembler.assemble(List.of("aaaa", "bbbb", "cccc"), 8);
        assertThat(batches).containsExactly("aaaabbbb", "cccc");
    }

    @Test
    void ceilingIsInclusive() {
        List<String> batches = BatchAssembler.assemble(List.of("aaaa", "bbbb"), 8);
        assertThat(batches).containsExactly("aaaabbbb");
    }

    @Test
    void oversizeBlockTravelsAloneWithoutEmptyBatches() {
        List<String> batches = BatchAssembler.assemble(List.of("0123456789AB", "cd", "ef"), 10);
        assertThat(batches).containsExactly("0123456789AB", "cdef");

        List<String> trailing = BatchAssembler.assemble(List.of("ab", "0123456789AB"), 10);
        assertThat(trailing).containsExactly("ab", "0123456789AB");
    }

    @Test
    void noBlocksMeansNoBatches() {
        assertThat(BatchAssembler.assemble(List.of(), 4000)).isEmpty();
    }

    @Test
    void everyBatchRespectsCeilingUnlessSingleBlock() {
        String block = "x".repeat(900);
        List<String> blocks = List.of(block, block, block, block, block, block, block, block, block);
        List<String> batches = BatchAssembler.assemble(blocks, 4000);
        assertThat(batches).hasSize(3);
        assertThat(batches).allSatisfy(batch -> assertThat(batch.length()).isLessThanOrEqualTo(4000));
        assertThat(String.join("", batches)).isEqualTo(String.join("", blocks));
    }
}
