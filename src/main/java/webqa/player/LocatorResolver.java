package webqa.player;

import webqa.model.BlueprintElement;
import webqa.model.ElementLocator;
import webqa.model.ElementLocator.Strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns a logical element name into a concrete selector using the blueprint,
 * trying rules in stability order: data-test → id → visible text →
 * placeholder → well-known table.
 *
 * <p>Resolution is pure: the DOM is never queried here and nothing is retried.
 * Waiting for the element is the caller's job (see {@link WaitStrategy}).
 *
 * <p>Rules apply to the blueprint entry whose {@code logical_name} matches; the
 * {@link KnownElements} table is consulted only when no such entry exists. An
 * entry that exists but carries none of the usable attributes fails.
 */
public class LocatorResolver {

    private static final Logger log = LoggerFactory.getLogger(LocatorResolver.class);

    private static final Pattern TAG_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9-]*");

    /**
     * One entry of the ordered fallback: applies when {@code attribute} is
     * non-blank on the blueprint entry, and builds the selector from it.
     */
    record LocatorRule(Strategy strategy,
                       Function<BlueprintElement, String> attribute,
                       BiFunction<BlueprintElement, String, String> selector) {

        Optional<ElementLocator> apply(BlueprintElement element) {
            String value = attribute.apply(element);
            if (!isUsable(value)) return Optional.empty();
            return Optional.of(new ElementLocator(strategy, selector.apply(element, value)));
        }
    }

    static final List<LocatorRule> RULES = List.of(
            new LocatorRule(Strategy.TEST_ID, BlueprintElement::getDataTest,
                    (el, v) -> "[data-test=" + cssString(v.trim()) + "]"),
            new LocatorRule(Strategy.ID, BlueprintElement::getId,
                    (el, v) -> v.trim()),
            new LocatorRule(Strategy.TEXT, BlueprintElement::getText,
                    (el, v) -> textXPath(scopeTag(el), xpathLiteral(normalizeSpace(v)))),
            new LocatorRule(Strategy.PLACEHOLDER, BlueprintElement::getPlaceholder,
                    (el, v) -> "[placeholder=" + cssString(v) + "]")
    );

    private final KnownElements knownElements;

    public LocatorResolver() {
        this(KnownElements.builtIn());
    }

    public LocatorResolver(KnownElements knownElements) {
        this.knownElements = knownElements;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Resolves {@code targetName} against {@code blueprint}.
     *
     * @param targetName logical name used by the step
     * @param blueprint  discovered elements of the page under test
     * @return the winning {@link ElementLocator}
     * @throws LocatorNotFoundException if no rule produces a selector
     */
    public ElementLocator resolve(String targetName, List<BlueprintElement> blueprint) {
        Optional<BlueprintElement> entry = findEntry(targetName, blueprint);
        if (entry.isPresent()) {
            return fromEntry(entry.get()).orElseThrow(() -> new LocatorNotFoundException(targetName,
                    "blueprint entry has no data_test, id, text or placeholder"));
        }
        return knownElements.lookup(targetName)
                .map(css -> {
                    log.debug("'{}' absent from blueprint, using well-known selector {}", targetName, css);
                    return new ElementLocator(Strategy.KNOWN, css);
                })
                .orElseThrow(() -> new LocatorNotFoundException(targetName,
                        "not in the UI blueprint and not a well-known element"));
    }

    /** Same as {@link #resolve} but reports a miss as an empty result. */
    public Optional<ElementLocator> tryResolve(String targetName, List<BlueprintElement> blueprint) {
        try {
            return Optional.of(resolve(targetName, blueprint));
        } catch (LocatorNotFoundException e) {
            return Optional.empty();
        }
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private Optional<ElementLocator> fromEntry(BlueprintElement element) {
        for (LocatorRule rule : RULES) {
            Optional<ElementLocator> locator = rule.apply(element);
            if (locator.isPresent()) {
                log.debug("Resolved '{}' via [{}]: {}",
                        element.getLogicalName(), rule.strategy(), locator.get().getValue());
                return locator;
            }
        }
        return Optional.empty();
    }

    /** First entry with a matching logical name; later duplicates are ignored. */
    static Optional<BlueprintElement> findEntry(String targetName, List<BlueprintElement> blueprint) {
        if (targetName == null || blueprint == null) return Optional.empty();
        BlueprintElement first = null;
        for (BlueprintElement el : blueprint) {
            if (el != null && targetName.equals(el.getLogicalName())) {
                if (first == null) {
                    first = el;
                } else {
                    log.warn("Duplicate logical name '{}' in blueprint, using the first entry", targetName);
                    break;
                }
            }
        }
        return Optional.ofNullable(first);
    }

    /**
     * Exact normalised-text match on {@code tag}, innermost only: an element
     * whose descendant of the same tag carries the same text is skipped, so
     * wrappers around the label never win in document order.
     */
    static String textXPath(String tag, String literal) {
        String matches = "normalize-space(.)=" + literal;
        return "//" + tag + "[" + matches + " and not(.//" + tag + "[" + matches + "])]";
    }

    private static String scopeTag(BlueprintElement element) {
        String tag = element.getTag();
        return tag != null && TAG_NAME.matcher(tag.trim()).matches() ? tag.trim().toLowerCase() : "*";
    }

    private static String normalizeSpace(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    /** Quotes {@code value} as an XPath 1.0 string literal, whatever quotes it contains. */
    static String xpathLiteral(String value) {
        if (!value.contains("'")) return "'" + value + "'";
        if (!value.contains("\"")) return "\"" + value + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }

    /** Quotes {@code value} as a CSS string. */
    static String cssString(String value) {
        String escaped = value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\a ");
        return "\"" + escaped + "\"";
    }

    private static boolean isUsable(String value) {
        return value != null && !value.isBlank();
    }
}
