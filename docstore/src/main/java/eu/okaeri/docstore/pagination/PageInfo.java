package eu.okaeri.docstore.pagination;

import lombok.Data;

@Data
public class PageInfo {

    /**
     * Position of the first item of the page, null for an empty page.
     */
    private final Long index;
    private final long total;
}
