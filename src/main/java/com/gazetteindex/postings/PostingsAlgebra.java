package com.gazetteindex.postings;

import com.gazetteindex.storage.PostingList;

import java.util.Arrays;
import java.util.List;

/**
 * 有序倒排列表的集合运算。
 *
 * <p>输入必须严格递增；所有运算的时间复杂度与输入总长度成线性关系，返回新对象，不修改输入。
 */
public final class PostingsAlgebra {
    private PostingsAlgebra() {
    }

    /**
     * 双指针求交集。
     *
     * @param left 倒排列表
     * @param right 倒排列表
     * @return 同时出现在两个列表中的行号
     */
    public static PostingList intersect(PostingList left, PostingList right) {
        if (left.isEmpty() || right.isEmpty()) {
            return PostingList.EMPTY;
        }
        int leftSize = left.size();
        int rightSize = right.size();
        int[] result = new int[Math.min(leftSize, rightSize)];
        int count = 0;
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < leftSize && rightIndex < rightSize) {
            int leftValue = left.rowId(leftIndex);
            int rightValue = right.rowId(rightIndex);
            if (leftValue == rightValue) {
                result[count++] = leftValue;
                leftIndex++;
                rightIndex++;
            } else if (leftValue < rightValue) {
                leftIndex++;
            } else {
                rightIndex++;
            }
        }
        return new PostingList(Arrays.copyOf(result, count));
    }

    /**
     * 双指针求并集，合并时跳过与上一个输出值相同的元素完成去重。
     *
     * @param left 倒排列表
     * @param right 倒排列表
     * @return 两个列表的并集
     */
    public static PostingList union(PostingList left, PostingList right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        int leftSize = left.size();
        int rightSize = right.size();
        int[] result = new int[leftSize + rightSize];
        int count = 0;
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < leftSize || rightIndex < rightSize) {
            int next;
            if (rightIndex >= rightSize
                || (leftIndex < leftSize && left.rowId(leftIndex) <= right.rowId(rightIndex))) {
                next = left.rowId(leftIndex++);
            } else {
                next = right.rowId(rightIndex++);
            }
            if (count == 0 || result[count - 1] != next) {
                result[count++] = next;
            }
        }
        return new PostingList(Arrays.copyOf(result, count));
    }

    /**
     * 对多个列表做左折叠并集。空列表不贡献元素，折叠继续进行。
     *
     * <p>总开销与折叠过程中处理的元素总数成正比，调用方可按长度排序以减少中间结果。
     *
     * @param lists 倒排列表集合
     * @return 全部列表的并集；输入为空时返回空列表
     */
    public static PostingList unionMany(List<PostingList> lists) {
        if (lists == null || lists.isEmpty()) {
            return PostingList.EMPTY;
        }
        PostingList accumulator = lists.get(0);
        for (int index = 1; index < lists.size(); index++) {
            accumulator = union(accumulator, lists.get(index));
        }
        return accumulator;
    }
}
