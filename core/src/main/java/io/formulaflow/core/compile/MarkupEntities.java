package io.formulaflow.core.compile;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the markup entities formulas pick up when they are stored in HTML or XML documents, so
 * {@code a &lt; b} compiles as {@code a < b}.
 *
 * <p>
 * Handles {@code &lt; &gt; &quot; &apos; &amp;} and numeric {@code &#NN;} / {@code &#xHH;}
 * references. {@code &amp;} is decoded last, so {@code &amp;lt;} becomes the literal text
 * {@code &lt;} rather than {@code <}.
 */
final class MarkupEntities {

    private static final Pattern NUMERIC = Pattern.compile("&#(?:[xX]([0-9a-fA-F]{1,6})|([0-9]{1,7}));");

    private MarkupEntities() {
        // utility class
    }

    static String decode(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        String decoded = decodeNumeric(text);
        return decoded.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static String decodeNumeric(String text) {
        Matcher m = NUMERIC.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            int codePoint = m.group(1) != null ? Integer.parseInt(m.group(1), 16) : Integer.parseInt(m.group(2));
            // Out-of-range references are left as written.
            String replacement = Character.isValidCodePoint(codePoint)
                    ? new String(Character.toChars(codePoint))
                    : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
