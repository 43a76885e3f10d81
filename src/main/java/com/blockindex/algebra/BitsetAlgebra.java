package com.blockindex.algebra;

import java.util.BitSet;

/**
 * 位图表示：每个文档一位，AND/OR 为对应的位运算，NOT 为全集位图减去操作数。
 *
 * 运算不修改入参，总是返回新位图。
 */
public final class BitsetAlgebra implements PostingAlgebra<BitSet> {
    private final BitSet fullSet;

    /**
     * @param fullSet 文档全集，必须严格递增
     */
    public BitsetAlgebra(int[] fullSet) {
        if (fullSet == null) {
            throw new IllegalArgumentException("全集不能为null");
        }
        SortedListAlgebra.requireStrictlyIncreasing(fullSet);
        BitSet bits = new BitSet(fullSet.length == 0 ? 0 : fullSet[fullSet.length - 1] + 1);
        for (int docId : fullSet) {
            bits.set(docId);
        }
        this.fullSet = bits;
    }

    @Override
    public BitSet fromDocIds(int[] docIds) {
        if (docIds == null) {
            throw new IllegalArgumentException("docIds不能为null");
        }
        BitSet bits = new BitSet(fullSet.length());
        for (int docId : docIds) {
            if (docId < 0 || !fullSet.get(docId)) {
                throw new IllegalArgumentException("docId不在文档全集内: " + docId);
            }
            bits.set(docId);
        }
        return bits;
    }

    @Override
    public BitSet and(BitSet left, BitSet right) {
        BitSet result = (BitSet) left.clone();
        result.and(right);
        return result;
    }

    @Override
    public BitSet or(BitSet left, BitSet right) {
        BitSet result = (BitSet) left.clone();
        result.or(right);
        return result;
    }

    @Override
    public BitSet not(BitSet operand) {
        BitSet result = (BitSet) fullSet.clone();
        result.andNot(operand);
        return result;
    }

    @Override
    public int[] toDocIds(BitSet postings) {
        return postings.stream().toArray();
    }

    @Override
    public PostingRepresentation representation() {
        return PostingRepresentation.BITSET;
    }
}
