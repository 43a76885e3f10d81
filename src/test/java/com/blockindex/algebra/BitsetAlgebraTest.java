package com.blockindex.algebra;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BitsetAlgebraTest {

    private final BitsetAlgebra algebra = new BitsetAlgebra(IntStream.range(0, 6).toArray());

    @Test
    void testBooleanOperations() {
        BitSet left = algebra.fromDocIds(new int[] {4, 0, 2, 2});
        BitSet right = algebra.fromDocIds(new int[] {2, 3, 4, 5});

        assertArrayEquals(new int[] {2, 4}, algebra.toDocIds(algebra.and(left, right)));
        assertArrayEquals(new int[] {0, 2, 3, 4, 5}, algebra.toDocIds(algebra.or(left, right)));
        assertArrayEquals(new int[] {1, 3, 5}, algebra.toDocIds(algebra.not(left)));
    }

    @Test
    void testOperandsAreNotMutated() {
        BitSet left = algebra.fromDocIds(new int[] {1});
        BitSet right = algebra.fromDocIds(new int[] {2});

        algebra.or(left, right);
        algebra.not(left);

        assertArrayEquals(new int[] {1}, algebra.toDocIds(left));
        assertArrayEquals(new int[] {2}, algebra.toDocIds(right));
    }

    @Test
    void testComplementStaysWithinFullSet() {
        BitSet complement = algebra.not(algebra.empty());

        assertEquals(6, complement.cardinality());
        assertEquals(6, complement.length());
        assertArrayEquals(new int[] {}, algebra.toDocIds(new BitsetAlgebra(new int[0]).not(new BitSet())));
    }

    @Test
    void testSparseFullSet() {
        BitsetAlgebra sparse = new BitsetAlgebra(new int[] {2, 4, 8});

        assertArrayEquals(new int[] {2, 8}, sparse.toDocIds(sparse.not(sparse.fromDocIds(new int[] {4}))));
        assertThrows(IllegalArgumentException.class, () -> sparse.fromDocIds(new int[] {3}));
    }

    @Test
    void testOutOfRangeDocIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> algebra.fromDocIds(new int[] {6}));
        assertThrows(IllegalArgumentException.class, () -> algebra.fromDocIds(new int[] {-1}));
        assertThrows(IllegalArgumentException.class, () -> new BitsetAlgebra(new int[] {1, 1}));
        assertThrows(IllegalArgumentException.class, () -> new BitsetAlgebra(null));
        assertEquals(PostingRepresentation.BITSET, algebra.representation());
    }
}
