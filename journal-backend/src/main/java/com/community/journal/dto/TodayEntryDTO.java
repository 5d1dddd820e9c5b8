package com.community.journal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TodayEntryDTO {
    private boolean exists;
    private Integer rating;
    private String comment;
    private List<String> tags;
    private String gifUrl;

    public static TodayEntryDTO absent() {
        return new TodayEntryDTO();
    }
}
