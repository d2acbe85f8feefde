package com.gazetteindex.query;

import com.gazetteindex.config.Constants;
import com.gazetteindex.config.EngineConfig;
import com.gazetteindex.index.PostingsSource;
import com.gazetteindex.postings.PostingsAlgebra;
import com.gazetteindex.storage.DateKeys;
import com.gazetteindex.storage.PostingList;
import com.gazetteindex.storage.RowRecord;
import com.gazetteindex.storage.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 结构化检索的查询规划与执行。
 *
 * <p>地点、类型条件直接取倒排列表；日期区间按天取倒排并估算并集大小，只有当估算值不超过
 * 其余候选中最短列表长度乘以选择性乘数时才物化为并集参与求交，否则改为逐行日期过滤。
 * 候选列表按长度升序依次求交，结果按行号升序回表，直到达到返回条数上限。
 */
public class QueryPlanner {
    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    private final PostingsSource postingsSource;
    private final RowSource rowSource;
    private final int selectivityMultiplier;
    private final int defaultLimit;
    private final int maxLimit;

    /**
     * 使用 EngineConfig 注入选择性乘数与返回条数范围。
     */
    public QueryPlanner(PostingsSource postingsSource, RowSource rowSource, EngineConfig config) {
        this(postingsSource, rowSource, config.getSelectivityMultiplier(), config.getDefaultLimit(), config.getMaxLimit());
    }

    /**
     * 使用默认常量构造。
     */
    public QueryPlanner(PostingsSource postingsSource, RowSource rowSource) {
        this(postingsSource, rowSource, Constants.SELECTIVITY_MULTIPLIER,
            Constants.DEFAULT_SEARCH_LIMIT, Constants.MAX_SEARCH_LIMIT);
    }

    private QueryPlanner(PostingsSource postingsSource, RowSource rowSource,
                         int selectivityMultiplier, int defaultLimit, int maxLimit) {
        if (postingsSource == null || rowSource == null) {
            throw new IllegalArgumentException("倒排来源与行存不能为空");
        }
        if (selectivityMultiplier < 0) {
            throw new IllegalArgumentException("选择性乘数不能为负数: " + selectivityMultiplier);
        }
        if (maxLimit < Constants.MIN_SEARCH_LIMIT) {
            throw new IllegalArgumentException("返回条数上限非法: " + maxLimit);
        }
        this.postingsSource = postingsSource;
        this.rowSource = rowSource;
        this.selectivityMultiplier = selectivityMultiplier;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * 执行检索。
     *
     * @param filters 检索条件
     * @return 按行号升序的命中结果，条数不超过生效上限
     * @throws MissingFilterException 没有任何可用倒排条件时抛出
     * @throws InvalidQueryException 条件不合法时抛出
     * @throws IOException 索引文件读取失败时抛出
     */
    public SearchResult search(SearchFilters filters) throws IOException {
        long startNanos = System.nanoTime();
        QueryPlan plan = plan(filters);
        PostingList matches = intersectCandidates(plan.candidates());

        long dateUpperExclusive = (long) plan.dateToKey() + Constants.DAY_SECONDS;
        List<SearchHit> hits = new ArrayList<>(Math.min(plan.limit(), matches.size()));
        for (int index = 0; index < matches.size() && hits.size() < plan.limit(); index++) {
            int rowId = matches.rowId(index);
            RowRecord record = rowSource.get(rowId);
            if (plan.datePostFilter()
                && (record.dateKey() < plan.dateFromKey() || record.dateKey() >= dateUpperExclusive)) {
                continue;
            }
            if (filters.companyCode() != null && record.companyCode() != filters.companyCode()) {
                continue;
            }
            hits.add(new SearchHit(rowId, record));
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("检索完成: 候选求交 {} 行, 命中 {} 行, 用时 {}ms", matches.size(), hits.size(), elapsedMs);
        return new SearchResult(List.copyOf(hits), hits.size(), elapsedMs, filters);
    }

    /**
     * 生成执行计划，不回表。
     *
     * @param filters 检索条件
     * @return 执行计划
     * @throws MissingFilterException 没有任何可用倒排条件时抛出
     * @throws InvalidQueryException 条件不合法时抛出
     * @throws IOException 索引文件读取失败时抛出
     */
    public QueryPlan plan(SearchFilters filters) throws IOException {
        if (filters == null) {
            throw new MissingFilterException();
        }
        int limit = clampLimit(filters.limit());
        List<QueryPlan.Candidate> candidates = new ArrayList<>(3);

        if (filters.locationCode() != null) {
            candidates.add(new QueryPlan.Candidate(Constants.INDEX_LOCATION,
                postingsSource.postings(Constants.INDEX_LOCATION, filters.locationCode())));
        }
        if (filters.typeCode() != null) {
            candidates.add(new QueryPlan.Candidate(Constants.INDEX_TYPE,
                postingsSource.postings(Constants.INDEX_TYPE, filters.typeCode())));
        }

        int dayCount = 0;
        long estimatedDateSize = 0;
        boolean dateMaterialized = false;
        boolean datePostFilter = false;
        int dateFromKey = 0;
        int dateToKey = 0;
        if (filters.hasDateRange()) {
            int[] dayKeys = resolveDayKeys(filters.dateFrom(), filters.dateTo());
            dayCount = dayKeys.length;
            dateFromKey = dayKeys[0];
            dateToKey = dayKeys[dayKeys.length - 1];

            List<PostingList> dayLists = new ArrayList<>(dayKeys.length);
            for (int dayKey : dayKeys) {
                PostingList dayList = postingsSource.postings(Constants.INDEX_DATE, dayKey);
                dayLists.add(dayList);
                estimatedDateSize += dayList.size();
            }
            long minBase = candidates.stream()
                .mapToLong(QueryPlan.Candidate::size)
                .min()
                .orElse(estimatedDateSize);
            if (estimatedDateSize <= minBase * selectivityMultiplier) {
                candidates.add(new QueryPlan.Candidate(Constants.INDEX_DATE, PostingsAlgebra.unionMany(dayLists)));
                dateMaterialized = true;
            } else {
                datePostFilter = true;
            }
            logger.debug("日期区间: {} 天, 估算 {} 行, minBase={}, 物化={}",
                dayCount, estimatedDateSize, minBase, dateMaterialized);
        }

        if (candidates.isEmpty()) {
            throw new MissingFilterException();
        }
        candidates.sort(Comparator.comparingInt(QueryPlan.Candidate::size));
        return new QueryPlan(List.copyOf(candidates), dayCount, estimatedDateSize, dateMaterialized,
            datePostFilter, dateFromKey, dateToKey, limit);
    }

    /**
     * 把请求的返回条数限制在 [1, maxLimit]，未指定时使用默认值。
     */
    public int clampLimit(Integer requested) {
        int limit = requested == null ? defaultLimit : requested;
        return Math.max(Constants.MIN_SEARCH_LIMIT, Math.min(maxLimit, limit));
    }

    /**
     * 按长度升序依次求交，任一中间结果或剩余列表为空即提前返回空。
     */
    static PostingList intersectCandidates(List<QueryPlan.Candidate> sortedCandidates) {
        PostingList current = sortedCandidates.get(0).postings();
        for (int index = 1; index < sortedCandidates.size(); index++) {
            PostingList next = sortedCandidates.get(index).postings();
            if (current.isEmpty() || next.isEmpty()) {
                return PostingList.EMPTY;
            }
            current = PostingsAlgebra.intersect(current, next);
        }
        return current;
    }

    private int[] resolveDayKeys(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new InvalidQueryException("日期区间必须同时提供起始日期与结束日期");
        }
        if (!DateKeys.isIndexable(from) || !DateKeys.isIndexable(to)) {
            throw new InvalidQueryException("日期超出可索引范围: " + from + " .. " + to);
        }
        return DateKeys.dayKeys(from, to);
    }
}
