package com.community.journal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * 待评价的匿名记录。不包含作者 id、昵称和作者自评分数，
 * 提交评分时由 (评价人, 日期) 的分配确定被评人。
 * done=true 时其它字段均为空。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NextReviewDTO {
    private boolean done;
    private LocalDate date;
    private String comment;
    private List<String> tags;
    private String gifUrl;

    public static NextReviewDTO finished() {
        NextReviewDTO dto = new NextReviewDTO();
        dto.setDone(true);
        return dto;
    }
}
