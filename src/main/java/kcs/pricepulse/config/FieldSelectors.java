package kcs.pricepulse.config;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Ordered candidate CSS selectors for one product field.
 * <p>
 * Candidates are tried in declared order and the first one yielding a non-blank value wins.
 * When {@link #attribute} is set the value is read from that attribute, otherwise from the
 * element's text.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FieldSelectors {

    private List<String> selectors = new ArrayList<>();

    /** Attribute to read (for example {@code src}); {@code null} means element text. */
    private String attribute;

    public static FieldSelectors text(String... selectors) {
        return new FieldSelectors(new ArrayList<>(List.of(selectors)), null);
    }

    public static FieldSelectors attribute(String attribute, String... selectors) {
        return new FieldSelectors(new ArrayList<>(List.of(selectors)), attribute);
    }

    public boolean isEmpty() {
        return selectors == null || selectors.isEmpty();
    }
}
