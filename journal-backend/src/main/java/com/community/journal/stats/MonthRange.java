package com.community.journal.stats;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

@Data
@AllArgsConstructor
public class MonthRange {
    private LocalDate monthStart;
    private LocalDate monthEnd;
}
