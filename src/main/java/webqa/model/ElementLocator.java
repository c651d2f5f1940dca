package webqa.model;

import org.openqa.selenium.By;

/**
 * A concrete selector produced by {@code LocatorResolver}, tagged with the rule
 * that produced it.
 *
 * <p>{@code value} is an element id for {@link Strategy#ID}, an XPath
 * expression for {@link Strategy#TEXT} and a CSS selector otherwise.
 */
public final class ElementLocator {

    public enum Strategy { TEST_ID, ID, TEXT, PLACEHOLDER, KNOWN }

    private final Strategy strategy;
    private final String value;

    public ElementLocator(Strategy strategy, String value) {
        this.strategy = strategy;
        this.value    = value;
    }

    public Strategy getStrategy() { return strategy; }
    public String   getValue()    { return value; }

    /** Converts this locator to a Selenium {@link By}. */
    public By toBy() {
        return switch (strategy) {
            case ID   -> By.id(value);
            case TEXT -> By.xpath(value);
            default   -> By.cssSelector(value);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementLocator)) return false;
        ElementLocator other = (ElementLocator) o;
        return strategy == other.strategy && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * strategy.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return String.format("ElementLocator{%s='%s'}", strategy, value);
    }
}
