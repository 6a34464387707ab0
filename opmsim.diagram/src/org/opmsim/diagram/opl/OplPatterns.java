package org.opmsim.diagram.opl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sentence patterns of the structured OPL grammar, one per sentence form.
 */
final class OplPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // --- definitions ---

    /** "A is a physical and systemic object." (either attribute order, article optional) */
    static final Pattern DEFINITION = Pattern.compile(
            "^\\s*(?<name>.+?)\\s+is\\s+(?:an?\\s+)?"
                    + "(?:(?<essence1>physical|informatical)\\s+and\\s+(?<affiliation1>systemic|environmental)"
                    + "|(?<affiliation2>systemic|environmental)\\s+and\\s+(?<essence2>physical|informatical))"
                    + "\\s+(?<kind>object|process)\\.+\\s*$", FLAGS);

    /** "Car is an informatical object." */
    static final Pattern DEFINITION_SINGLE = Pattern.compile(
            "^\\s*(?<name>.+?)\\s+is\\s+(?:an?\\s+)?(?<attr>physical|informatical|systemic|environmental)"
                    + "\\s+(?<kind>object|process)\\.+\\s*$", FLAGS);

    /** "Raw Metal Bar is physical." declares an object */
    static final Pattern DEFINITION_MINIMAL = Pattern.compile(
            "^\\s*(?<name>.+?)\\s+is\\s+(?<attr>physical|informatical|systemic|environmental)\\.+\\s*$", FLAGS);

    // --- procedural ---

    static final Pattern CONSUMES = Pattern.compile(
            "^\\s*(?<p>.+?)\\s+consumes?\\s+(?<obj>.+?)(?:\\s+at\\s+state\\s+(?<state>[\\w-]+))?\\.\\s*$", FLAGS);

    static final Pattern INPUTS = Pattern.compile(
            "^\\s*(?<p>.+?)\\s+takes?\\s+(?<objs>.+?)\\s+as\\s+input\\.\\s*$", FLAGS);

    static final Pattern YIELDS = Pattern.compile(
            "^\\s*(?<p>.+?)\\s+yields?\\s+(?<obj>.+?)(?:\\s+at\\s+state\\s+(?<state>[\\w-]+))?\\.\\s*$", FLAGS);

    static final Pattern HANDLES = Pattern.compile(
            "^\\s*(?<agents>.+?)\\s+handles?\\s+(?<p>.+?)\\.\\s*$", FLAGS);

    static final Pattern REQUIRES = Pattern.compile(
            "^\\s*(?<p>.+?)\\s+requires?\\s+(?<objs>.+?)\\.\\s*$", FLAGS);

    static final Pattern AFFECTS = Pattern.compile(
            "^\\s*(?<x>.+?)\\s+affects?\\s+(?<y>.+?)\\.\\s*$", FLAGS);

    static final Pattern CHANGES = Pattern.compile(
            "^\\s*(?<p>.+?)\\s+changes?\\s+(?<obj>.+?)\\s+from\\s+(?<from>.+?)\\s+to\\s+(?<to>.+?)\\.\\s*$", FLAGS);

    // --- structural ---

    static final Pattern CONSISTS_OF = Pattern.compile(
            "^\\s*(?<whole>.+?)\\s+consists\\s+of\\s+(?<parts>.+?)\\.\\s*$", FLAGS);

    static final Pattern CHARACTERIZED_BY = Pattern.compile(
            "^\\s*(?<obj>.+?)\\s+is\\s+characterized\\s+by\\s+(?<attrs>.+?)\\.\\s*$", FLAGS);

    static final Pattern EXHIBITS = Pattern.compile(
            "^\\s*(?<obj>.+?)\\s+exhibits?\\s+(?<attrs>.+?)\\.\\s*$", FLAGS);

    static final Pattern GENERALIZES = Pattern.compile(
            "^\\s*(?<general>.+?)\\s+generalizes?\\s+(?<subs>.+?)\\.\\s*$", FLAGS);

    /** "Freezing, Dehydrating and Canning are Spoilage Slowing." */
    static final Pattern ARE = Pattern.compile(
            "^\\s*(?<subs>.+?)\\s+are\\s+(?<general>.+?)\\.\\s*$", FLAGS);

    static final Pattern HAS_INSTANCES = Pattern.compile(
            "^\\s*(?<cls>.+?)\\s+has\\s+instances\\s+(?<insts>.+?)\\.\\s*$", FLAGS);

    static final Pattern INSTANCE_OF = Pattern.compile(
            "^\\s*(?<inst>.+?)\\s+is\\s+an\\s+instance\\s+of\\s+(?<cls>.+?)\\.\\s*$", FLAGS);

    /** Generalization only when the general name is capitalized; case sensitive on purpose. */
    static final Pattern IS_A = Pattern.compile(
            "^\\s*(?<sub>.+?)\\s+is\\s+an?\\s+(?<general>.+?)\\.\\s*$");

    // --- states ---

    static final Pattern CAN_BE = Pattern.compile(
            "^\\s*(?<obj>.+?)\\s+can\\s+be\\s+(?<states>.+?)\\.\\s*$", FLAGS);

    /** "Door is open." names a single state when the state starts in lower case */
    static final Pattern IS_STATE = Pattern.compile(
            "^\\s*(?<obj>.+?)\\s+is\\s+(?<state>[^\\s.]+)\\.\\s*$");

    /** "Book." declares a thing */
    static final Pattern NAME = Pattern.compile(
            "^\\s*(?<name>[\\p{Lu}\\p{N}][\\p{L}\\p{N} _'-]*)\\.\\s*$");

    private static final Pattern LIST_CONJUNCTION = Pattern.compile("\\s+(?:and|or)\\s+", FLAGS);
    private static final Pattern STATE_CONJUNCTION = Pattern.compile("\\s+or\\s+", FLAGS);

    private OplPatterns() {
    }

    static String norm(String name) {
        String value = name.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    /** "A, B and C" to [A, B, C], duplicates removed. */
    static List<String> splitNames(String text) {
        return split(LIST_CONJUNCTION, text);
    }

    /** "open, closed or torn" to [open, closed, torn]; only "or" separates states. */
    static List<String> splitStates(String text) {
        return split(STATE_CONJUNCTION, text);
    }

    private static List<String> split(Pattern conjunction, String text) {
        String flat = conjunction.matcher(stripDots(text.trim())).replaceAll(", ");
        Set<String> names = new LinkedHashSet<>();
        for (String part : flat.split(",")) {
            String name = norm(part);
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    private static String stripDots(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }

    static boolean isAttributeWord(String word) {
        String lower = word.toLowerCase();
        return lower.equals("physical") || lower.equals("informatical")
                || lower.equals("systemic") || lower.equals("environmental");
    }

    static boolean startsLowerCase(String text) {
        return !text.isEmpty() && Character.isLowerCase(text.charAt(0));
    }

    static boolean startsUpperCase(String text) {
        return !text.isEmpty() && Character.isUpperCase(text.charAt(0));
    }
}
