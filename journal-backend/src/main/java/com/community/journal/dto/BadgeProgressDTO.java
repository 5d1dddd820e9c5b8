package com.community.journal.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeProgressDTO {
    private long current;
    private int target;
    private int percent;   // 0..100
}
