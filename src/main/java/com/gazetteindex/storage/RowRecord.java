package com.gazetteindex.storage;

/**
 * 行存中的一条定长记录，六个字段均为整数编码。
 *
 * @param dateKey 日期键（1960-01-01 起的秒数，按天对齐）
 * @param locationCode 地点编码
 * @param typeCode 公告类型编码
 * @param companyCode 公司编码
 * @param adId 公告编号
 * @param adLinkCode 公告链接编码
 */
public record RowRecord(
        int dateKey,
        int locationCode,
        int typeCode,
        int companyCode,
        int adId,
        int adLinkCode
) {
    /**
     * 按字段读取对应值。
     *
     * @param field 字段
     * @return 字段值
     */
    public int valueOf(RowField field) {
        return switch (field) {
            case DATE_KEY -> dateKey;
            case LOCATION -> locationCode;
            case TYPE -> typeCode;
            case COMPANY -> companyCode;
            case AD_ID -> adId;
            case AD_LINK -> adLinkCode;
        };
    }
}
