package com.blockindex.algebra;

import java.util.Arrays;

/**
 * 升序文档 ID 数组表示：交/并/差均为线性归并。
 */
public final class SortedListAlgebra implements PostingAlgebra<int[]> {
    private final int[] fullSet;

    /**
     * @param fullSet 文档全集，必须严格递增
     */
    public SortedListAlgebra(int[] fullSet) {
        if (fullSet == null) {
            throw new IllegalArgumentException("全集不能为null");
        }
        requireStrictlyIncreasing(fullSet);
        this.fullSet = Arrays.copyOf(fullSet, fullSet.length);
    }

    @Override
    public int[] fromDocIds(int[] docIds) {
        if (docIds == null) {
            throw new IllegalArgumentException("docIds不能为null");
        }
        int[] sorted = Arrays.copyOf(docIds, docIds.length);
        Arrays.sort(sorted);
        int distinctLength = 0;
        for (int index = 0; index < sorted.length; index++) {
            if (distinctLength == 0 || sorted[distinctLength - 1] != sorted[index]) {
                sorted[distinctLength++] = sorted[index];
            }
        }
        return Arrays.copyOf(sorted, distinctLength);
    }

    @Override
    public int[] and(int[] left, int[] right) {
        return intersect(left, right);
    }

    @Override
    public int[] or(int[] left, int[] right) {
        return union(left, right);
    }

    @Override
    public int[] not(int[] operand) {
        return difference(fullSet, operand);
    }

    @Override
    public int[] toDocIds(int[] postings) {
        return Arrays.copyOf(postings, postings.length);
    }

    @Override
    public PostingRepresentation representation() {
        return PostingRepresentation.SORTED_LIST;
    }

    /**
     * 有序交集。
     */
    public static int[] intersect(int[] left, int[] right) {
        int[] result = new int[Math.min(left.length, right.length)];
        int leftIndex = 0;
        int rightIndex = 0;
        int resultLength = 0;
        while (leftIndex < left.length && rightIndex < right.length) {
            if (left[leftIndex] == right[rightIndex]) {
                result[resultLength++] = left[leftIndex];
                leftIndex++;
                rightIndex++;
            } else if (left[leftIndex] < right[rightIndex]) {
                leftIndex++;
            } else {
                rightIndex++;
            }
        }
        return Arrays.copyOf(result, resultLength);
    }

    /**
     * 有序并集。
     */
    public static int[] union(int[] left, int[] right) {
        int[] result = new int[left.length + right.length];
        int leftIndex = 0;
        int rightIndex = 0;
        int resultLength = 0;
        while (leftIndex < left.length && rightIndex < right.length) {
            if (left[leftIndex] == right[rightIndex]) {
                result[resultLength++] = left[leftIndex];
                leftIndex++;
                rightIndex++;
            } else if (left[leftIndex] < right[rightIndex]) {
                result[resultLength++] = left[leftIndex++];
            } else {
                result[resultLength++] = right[rightIndex++];
            }
        }
        while (leftIndex < left.length) {
            result[resultLength++] = left[leftIndex++];
        }
        while (rightIndex < right.length) {
            result[resultLength++] = right[rightIndex++];
        }
        return Arrays.copyOf(result, resultLength);
    }

    /**
     * 有序差集 left \ right。
     */
    public static int[] difference(int[] left, int[] right) {
        int[] result = new int[left.length];
        int leftIndex = 0;
        int rightIndex = 0;
        int resultLength = 0;
        while (leftIndex < left.length) {
            if (rightIndex >= right.length || left[leftIndex] < right[rightIndex]) {
                result[resultLength++] = left[leftIndex++];
            } else if (left[leftIndex] == right[rightIndex]) {
                leftIndex++;
                rightIndex++;
            } else {
                rightIndex++;
            }
        }
        return Arrays.copyOf(result, resultLength);
    }

    static void requireStrictlyIncreasing(int[] docIds) {
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
    }
}
