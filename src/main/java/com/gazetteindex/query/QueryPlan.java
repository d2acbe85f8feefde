package com.gazetteindex.query;

import com.gazetteindex.storage.PostingList;

import java.util.List;

/**
 * 一次检索的执行计划。
 *
 * @param candidates 参与求交的倒排列表，已按长度升序排列
 * @param dayCount 日期区间覆盖的天数，无日期条件时为 0
 * @param estimatedDateSize 各天倒排长度之和
 * @param dateMaterialized 是否把日期区间物化为并集参与求交
 * @param datePostFilter 是否需要逐行按日期过滤
 * @param dateFromKey 日期下界（含）
 * @param dateToKey 最后一天的日期键（含当天）
 * @param limit 生效的返回条数
 */
public record QueryPlan(
        List<Candidate> candidates,
        int dayCount,
        long estimatedDateSize,
        boolean dateMaterialized,
        boolean datePostFilter,
        int dateFromKey,
        int dateToKey,
        int limit
) {
    /**
     * 具名候选列表。
     *
     * @param name 来源索引名
     * @param postings 倒排列表
     */
    public record Candidate(String name, PostingList postings) {
        public int size() {
            return postings.size();
        }
    }

    public List<String> candidateNames() {
        return candidates.stream().map(Candidate::name).toList();
    }
}
