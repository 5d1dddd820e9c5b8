package com.community.journal.dto;

import lombok.Data;

import java.util.List;

@Data
public class EntryRequest {
    private Integer rating;
    private String comment;
    private List<String> tags;
    private String gifUrl;
}
