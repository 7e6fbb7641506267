package com.bbthechange.podfeed.dto.vimeo;

import com.bbthechange.podfeed.dto.PictureSize;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VimeoPictures {
    private List<PictureSize> sizes;
}
