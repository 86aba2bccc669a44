package org.quill.compiler.backend.emit;

import java.util.Locale;
import java.util.Map;

/**
 * The fixed doctype literals.
 */
public final class Doctypes {

    private static final Map<String, String> LITERALS = Map.of(
            "html", "<!DOCTYPE html>",
            "xml", "<?xml version=\"1.0\" encoding=\"utf-8\" ?>",
            "transitional", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Transitional//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-transitional.dtd\">",
            "strict", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">",
            "frameset", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Frameset//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-frameset.dtd\">",
            "1.1", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.1//EN\" \"http://www.w3.org/TR/xhtml11/DTD/xhtml11.dtd\">",
            "basic", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML Basic 1.1//EN\" \"http://www.w3.org/TR/xhtml-basic/xhtml-basic11.dtd\">",
            "mobile", "<!DOCTYPE html PUBLIC \"-//WAPFORUM//DTD XHTML Mobile 1.2//EN\" \"http://www.openmobilealliance.org/tech/DTD/xhtml-mobile12.dtd\">",
            "plist", "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\" \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">");

    private Doctypes() {}

    /**
     * @param kind The doctype kind as written.
     * @return The literal for a known kind, otherwise {@code <!DOCTYPE kind>}.
     */
    public static String literal(String kind) {
        String known = LITERALS.get(kind.toLowerCase(Locale.ROOT));
        return known != null ? known : "<!DOCTYPE " + kind + ">";
    }

    /**
     * Terse output (bare boolean attributes, {@code <br>} for void elements) is used for
     * HTML5 only; every other doctype selects XML-style output.
     *
     * @param kind The doctype kind as written.
     * @return Whether the doctype selects terse output.
     */
    public static boolean isTerse(String kind) {
        return kind.equalsIgnoreCase("html");
    }
}
