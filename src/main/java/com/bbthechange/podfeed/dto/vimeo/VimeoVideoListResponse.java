package com.bbthechange.podfeed.dto.vimeo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Paginated body of GET /{channels|groups|users}/{id}/videos.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VimeoVideoListResponse {

    private Integer total;

    private Integer page;

    @JsonProperty("per_page")
    private Integer perPage;

    private VimeoPaging paging;

    private List<VimeoVideoResponse> data;

    /**
     * Relative links to neighbouring pages; next is null on the last page.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VimeoPaging {
        private String next;
        private String previous;
        private String first;
        private String last;
    }
}
