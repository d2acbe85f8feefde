package com.gazetteindex.query;

import java.time.LocalDate;

/**
 * 已解析为整数编码与日历日期的检索条件，所有字段均可为空。
 *
 * @param locationCode 地点编码
 * @param typeCode 公告类型编码
 * @param dateFrom 起始日期（含）
 * @param dateTo 结束日期（含）
 * @param companyCode 公司编码，仅作为逐行过滤条件
 * @param limit 返回条数，会被限制在允许范围内
 */
public record SearchFilters(
        Integer locationCode,
        Integer typeCode,
        LocalDate dateFrom,
        LocalDate dateTo,
        Integer companyCode,
        Integer limit
) {
    public boolean hasDateRange() {
        return dateFrom != null || dateTo != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer locationCode;
        private Integer typeCode;
        private LocalDate dateFrom;
        private LocalDate dateTo;
        private Integer companyCode;
        private Integer limit;

        private Builder() {
        }

        public Builder locationCode(Integer locationCode) {
            this.locationCode = locationCode;
            return this;
        }

        public Builder typeCode(Integer typeCode) {
            this.typeCode = typeCode;
            return this;
        }

        public Builder dateRange(LocalDate from, LocalDate to) {
            this.dateFrom = from;
            this.dateTo = to;
            return this;
        }

        public Builder companyCode(Integer companyCode) {
            this.companyCode = companyCode;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public SearchFilters build() {
            return new SearchFilters(locationCode, typeCode, dateFrom, dateTo, companyCode, limit);
        }
    }
}
