package com.community.journal.stats;

import com.community.journal.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * 日期工具：以配置时区计算"今天 / 昨天"，以及月份区间与格式校验。
 */
@Component
public class JournalCalendar {

    private static final Pattern DATE_FORMAT = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern MONTH_FORMAT = Pattern.compile("^\\d{4}-\\d{2}$");

    private final Clock clock;

    public JournalCalendar(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate yesterday() {
        return today().minusDays(1);
    }

    /**
     * 当前月份（或参数指定月份）的首尾日期
     */
    public MonthRange monthRange(String month) {
        return monthRange(month, today());
    }

    /**
     * @param month YYYY-MM；为空或格式不对时退回 reference 所在月份
     */
    public static MonthRange monthRange(String month, LocalDate reference) {
        YearMonth yearMonth = YearMonth.from(reference);
        if (isValidMonthFormat(month)) {
            try {
                yearMonth = YearMonth.parse(month);
            } catch (DateTimeParseException e) {
                // 例如 2024-13：格式对但月份非法，同样退回当前月
                yearMonth = YearMonth.from(reference);
            }
        }
        return new MonthRange(yearMonth.atDay(1), yearMonth.atEndOfMonth());
    }

    public static boolean isValidDateFormat(String date) {
        return date != null && DATE_FORMAT.matcher(date).matches();
    }

    public static boolean isValidMonthFormat(String month) {
        return month != null && MONTH_FORMAT.matcher(month).matches();
    }

    /**
     * 解析 YYYY-MM-DD，非法输入抛 ValidationException
     */
    public static LocalDate parseDate(String date) {
        if (!isValidDateFormat(date)) {
            throw new ValidationException("Date must use the YYYY-MM-DD format");
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid calendar date: " + date);
        }
    }
}
