package com.blockindex.algebra;

/**
 * 倒排集合表示方式，作为配置项选择代数实现。
 */
public enum PostingRepresentation {
    /** 升序文档 ID 数组，NOT 需要显式全集 */
    SORTED_LIST {
        @Override
        public PostingAlgebra<?> newAlgebra(int[] fullSet) {
            return new SortedListAlgebra(fullSet);
        }
    },
    /** 位图，每个文档一位，补集限定在全集位图内 */
    BITSET {
        @Override
        public PostingAlgebra<?> newAlgebra(int[] fullSet) {
            return new BitsetAlgebra(fullSet);
        }
    };

    /**
     * 以给定文档全集创建代数实现。
     *
     * @param fullSet 严格递增的文档 ID 全集
     */
    public abstract PostingAlgebra<?> newAlgebra(int[] fullSet);
}
