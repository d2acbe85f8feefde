package com.gazetteindex.postings;

import com.gazetteindex.storage.PostingList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 倒排集合运算测试，随机用例以 TreeSet 结果为准。
 */
class PostingsAlgebraTest {

    @Test
    @DisplayName("intersect: 基本用例")
    void testIntersectBasic() {
        assertEquals(PostingList.of(3, 7), PostingsAlgebra.intersect(PostingList.of(1, 3, 5, 7), PostingList.of(2, 3, 7, 9)));
        assertEquals(PostingList.EMPTY, PostingsAlgebra.intersect(PostingList.of(1, 2), PostingList.of(3, 4)));
        assertEquals(PostingList.EMPTY, PostingsAlgebra.intersect(PostingList.EMPTY, PostingList.of(3, 4)));
        assertEquals(PostingList.EMPTY, PostingsAlgebra.intersect(PostingList.of(3, 4), PostingList.EMPTY));
    }

    @Test
    @DisplayName("union: 去重合并，空输入返回另一侧")
    void testUnionBasic() {
        assertEquals(PostingList.of(1, 2, 3, 5, 7), PostingsAlgebra.union(PostingList.of(1, 3, 5), PostingList.of(2, 3, 7)));

        PostingList right = PostingList.of(4, 8);
        assertSame(right, PostingsAlgebra.union(PostingList.EMPTY, right));
        assertSame(right, PostingsAlgebra.union(right, PostingList.EMPTY));
    }

    @Test
    @DisplayName("unionMany: 空集合、单元素与空列表混入")
    void testUnionManyEdgeCases() {
        assertEquals(PostingList.EMPTY, PostingsAlgebra.unionMany(List.of()));
        assertEquals(PostingList.of(1, 2), PostingsAlgebra.unionMany(List.of(PostingList.of(1, 2))));
        assertEquals(PostingList.of(1, 2, 5, 9), PostingsAlgebra.unionMany(List.of(
            PostingList.EMPTY, PostingList.of(2, 9), PostingList.EMPTY, PostingList.of(1, 5), PostingList.of(2))));
    }

    @Test
    @DisplayName("随机用例: 与集合语义一致")
    void testRandomAgainstTreeSet() {
        Random random = new Random(20240229L);
        for (int round = 0; round < 200; round++) {
            TreeSet<Integer> left = randomSet(random);
            TreeSet<Integer> right = randomSet(random);

            TreeSet<Integer> expectedIntersection = new TreeSet<>(left);
            expectedIntersection.retainAll(right);
            TreeSet<Integer> expectedUnion = new TreeSet<>(left);
            expectedUnion.addAll(right);

            PostingList intersection = PostingsAlgebra.intersect(toPostingList(left), toPostingList(right));
            PostingList union = PostingsAlgebra.union(toPostingList(left), toPostingList(right));

            assertEquals(toPostingList(expectedIntersection), intersection);
            assertEquals(toPostingList(expectedUnion), union);
            assertTrue(intersection.size() <= Math.min(left.size(), right.size()));
            assertTrue(union.size() >= Math.max(left.size(), right.size()));
        }
    }

    @Test
    @DisplayName("随机用例: 交换律、结合律与幂等")
    void testAlgebraicLaws() {
        Random random = new Random(42L);
        for (int round = 0; round < 100; round++) {
            PostingList a = toPostingList(randomSet(random));
            PostingList b = toPostingList(randomSet(random));
            PostingList c = toPostingList(randomSet(random));

            assertEquals(PostingsAlgebra.intersect(a, b), PostingsAlgebra.intersect(b, a));
            assertEquals(PostingsAlgebra.union(a, b), PostingsAlgebra.union(b, a));
            assertEquals(a, PostingsAlgebra.union(a, a));
            assertEquals(a, PostingsAlgebra.intersect(a, a));
            assertEquals(PostingsAlgebra.union(PostingsAlgebra.union(a, b), c),
                PostingsAlgebra.union(a, PostingsAlgebra.union(b, c)));
            assertEquals(PostingsAlgebra.unionMany(List.of(a, b, c)), PostingsAlgebra.unionMany(List.of(c, a, b)));
        }
    }

    private static TreeSet<Integer> randomSet(Random random) {
        TreeSet<Integer> values = new TreeSet<>();
        int size = random.nextInt(40);
        int bound = 1 + random.nextInt(120);
        for (int index = 0; index < size; index++) {
            values.add(random.nextInt(bound));
        }
        return values;
    }

    private static PostingList toPostingList(TreeSet<Integer> values) {
        List<Integer> ordered = new ArrayList<>(values);
        int[] rowIds = new int[ordered.size()];
        for (int index = 0; index < rowIds.length; index++) {
            rowIds[index] = ordered.get(index);
        }
        return new PostingList(rowIds);
    }
}
