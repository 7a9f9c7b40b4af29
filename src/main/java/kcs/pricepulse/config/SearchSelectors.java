package kcs.pricepulse.config;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.Getter;
import lombok.Setter;

/**
 * Search surface of a platform: where to send a query and how to read the result entries.
 * Name, price and link selectors are evaluated relative to each result entry.
 */
@Getter
@Setter
public class SearchSelectors {

    /** Search URL with a {@code {query}} placeholder, e.g. {@code https://www.flipkart.com/search?q={query}}. */
    private String urlTemplate;

    /** Selector of one result entry on the search page. */
    private String resultSelector;

    private FieldSelectors name = new FieldSelectors();

    private FieldSelectors price = new FieldSelectors();

    /** Link to the listing; when the entry itself carries an href it is used first. */
    private FieldSelectors link = FieldSelectors.attribute("href", "a[href]");

    public String searchUrl(String query) {
        String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
        return urlTemplate.replace("{query}", encoded);
    }
}
