package ai.pkgedit.rewrite;

import org.jetbrains.annotations.Nullable;

/**
 * Where a new array element goes visually.
 *
 * @param elementIndent indentation of the new element's line, or null to keep it on the current line
 * @param unit one indentation step, used for content nested inside the new element
 * @param closingIndent indentation for the closing bracket when an empty array is expanded over several lines
 */
public record Placement(@Nullable String elementIndent, String unit, String closingIndent) {

    public static Placement inline(String unit) {
        return new Placement(null, unit, "");
    }

    public boolean isMultiline() {
        return elementIndent != null;
    }
}
