package kcs.pricepulse.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Extraction configuration of one e-commerce platform.
 * Adding a platform is a matter of adding an entry under {@code scraper.platforms}.
 */
@Getter
@Setter
public class PlatformSelectors {

    /** Map key under {@code scraper.platforms}; filled in by {@code SelectorTable}. */
    private String key;

    private String displayName;

    /** Host names served by this platform; sub-domains match as well. */
    private List<String> hosts = new ArrayList<>();

    /** Element that must be present before the product page is read. */
    private String readySelector;

    private FieldSelectors name = new FieldSelectors();

    private FieldSelectors price = new FieldSelectors();

    private FieldSelectors image = FieldSelectors.attribute("src");

    private FieldSelectors brand = new FieldSelectors();

    /** Absent when the platform cannot be searched. */
    private SearchSelectors search;

    public boolean isSearchable() {
        return search != null && search.getUrlTemplate() != null && search.getResultSelector() != null;
    }

    public String label() {
        return displayName != null ? displayName : key;
    }
}
