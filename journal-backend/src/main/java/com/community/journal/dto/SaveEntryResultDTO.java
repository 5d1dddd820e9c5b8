package com.community.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaveEntryResultDTO {
    @JsonProperty("isUpdate")
    private boolean update;          // true：覆盖了今天已有的记录
    private List<String> newBadges;  // 本次新获得的徽章 id
}
