package com.gazetteindex.storage;

import com.gazetteindex.config.Constants;

import java.time.LocalDate;

/**
 * 日期键编码：1960-01-01 UTC 起的秒数，按天对齐。
 */
public final class DateKeys {
    private static final long EPOCH_DAY_1960 = Constants.DATE_KEY_EPOCH.toEpochDay();

    private DateKeys() {
    }

    /**
     * 将日历日期转换为日期键。
     *
     * @param date 日期
     * @return 当天零点对应的日期键
     * @throws ArithmeticException 日期键超出 int32 范围时抛出
     */
    public static int toKey(LocalDate date) {
        return Math.toIntExact(toLongKey(date));
    }

    /**
     * 将日期键还原为日历日期，非整天的键向下取整。
     */
    public static LocalDate toDate(int dateKey) {
        return LocalDate.ofEpochDay(EPOCH_DAY_1960 + Math.floorDiv(dateKey, Constants.DAY_SECONDS));
    }

    /**
     * 判断日期是否可编码为 int32 日期键。
     */
    public static boolean isIndexable(LocalDate date) {
        long key = toLongKey(date);
        return key >= Integer.MIN_VALUE && key <= Integer.MAX_VALUE;
    }

    /**
     * 返回闭区间 [from, to] 内每一天的日期键，区间颠倒时自动交换。
     *
     * @param from 起始日期
     * @param to 结束日期
     * @return 按天递增的日期键
     */
    public static int[] dayKeys(LocalDate from, LocalDate to) {
        LocalDate start = from.isAfter(to) ? to : from;
        LocalDate end = from.isAfter(to) ? from : to;
        long first = toLongKey(start);
        int dayCount = Math.toIntExact(end.toEpochDay() - start.toEpochDay() + 1);
        int[] keys = new int[dayCount];
        for (int index = 0; index < dayCount; index++) {
            keys[index] = Math.toIntExact(first + (long) index * Constants.DAY_SECONDS);
        }
        return keys;
    }

    private static long toLongKey(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("日期不能为空");
        }
        return (date.toEpochDay() - EPOCH_DAY_1960) * Constants.DAY_SECONDS;
    }
}
