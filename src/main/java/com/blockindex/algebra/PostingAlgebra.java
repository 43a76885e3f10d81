package com.blockindex.algebra;

/**
 * 倒排集合的布尔代数，作用于封闭的文档全集。
 *
 * 类型参数 P 是具体表示；同一表达式的两侧必须使用同一种表示。
 *
 * @param <P> 倒排集合表示
 */
public interface PostingAlgebra<P> {

    /**
     * 由文档 ID 构造集合，重复 ID 只保留一次。
     */
    P fromDocIds(int[] docIds);

    /**
     * 交集。
     */
    P and(P left, P right);

    /**
     * 并集。
     */
    P or(P left, P right);

    /**
     * 相对文档全集的补集。
     */
    P not(P operand);

    /**
     * 转换为升序文档 ID 数组。
     */
    int[] toDocIds(P postings);

    /**
     * 空集合。
     */
    default P empty() {
        return fromDocIds(new int[0]);
    }

    PostingRepresentation representation();
}
