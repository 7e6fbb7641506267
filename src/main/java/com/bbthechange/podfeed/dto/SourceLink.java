package com.bbthechange.podfeed.dto;

import com.bbthechange.podfeed.model.SourceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a feed URL points at.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceLink {
    private SourceType sourceType;
    private String itemId;
}
