package webqa.player;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static selectors for elements that appear only after navigation (landing
 * pages, menus) and are therefore often missing from a blueprint crawled on
 * the entry page.
 *
 * <p>Consulted by {@link LocatorResolver} only when the blueprint has no entry
 * for a logical name.
 */
public final class KnownElements {

    private static final Map<String, String> BUILT_IN;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Inventory_List",      ".inventory_list");
        m.put("Inventory_Container", "#inventory_container");
        m.put("Products_Title",      ".title");
        m.put("Shopping_Cart_Link",  ".shopping_cart_link");
        m.put("Shopping_Cart_Badge", ".shopping_cart_badge");
        m.put("Burger_Menu_Button",  "#react-burger-menu-btn");
        m.put("Logout_Link",         "#logout_sidebar_link");
        m.put("Error_Message",       "[data-test=\"error\"]");
        BUILT_IN = Collections.unmodifiableMap(m);
    }

    private final Map<String, String> selectors;

    private KnownElements(Map<String, String> selectors) {
        this.selectors = Collections.unmodifiableMap(selectors);
    }

    /** The built-in table only. */
    public static KnownElements builtIn() {
        return new KnownElements(new LinkedHashMap<>(BUILT_IN));
    }

    /** The built-in table with {@code overrides} added on top (override wins). */
    public static KnownElements withOverrides(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(BUILT_IN);
        if (overrides != null) merged.putAll(overrides);
        return new KnownElements(merged);
    }

    /** An empty table, for callers that want blueprint-only resolution. */
    public static KnownElements none() {
        return new KnownElements(new LinkedHashMap<>());
    }

    /** CSS selector for {@code logicalName}, if it is a well-known element. */
    public Optional<String> lookup(String logicalName) {
        if (logicalName == null) return Optional.empty();
        return Optional.ofNullable(selectors.get(logicalName));
    }
}
