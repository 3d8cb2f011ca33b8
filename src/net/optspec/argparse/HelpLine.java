package net.optspec.argparse;

import java.util.ArrayList;
import java.util.Formatter;
import java.util.List;

/**
 * One option's line of help text: a head (name and value placeholder) and
 * a tail (description and parenthesized addenda such as the default).
 */
public class HelpLine {

    private final String name;
    private final String params;
    private final String description;
    private final List<String> addenda;

    public HelpLine(String name, String params, String description) {
        this.name = adaptNull(name);
        this.params = adaptNull(params);
        this.description = adaptNull(description);
        this.addenda = new ArrayList<String>();
    }

    public String getName() {
        return name;
    }

    public String getParams() {
        return params;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAddenda() {
        return addenda;
    }
    public void addAddendum(String entry) {
        addenda.add(entry);
    }

    /** The name followed by the parameter placeholder (if any). */
    public String getHead() {
        return (params.isEmpty()) ? name : name + " " + params;
    }

    private String getTail() {
        StringBuilder sb = new StringBuilder(description);
        boolean first = true;
        for (String a : addenda) {
            if (a == null) continue;
            if (first) {
                if (sb.length() != 0) sb.append(' ');
                sb.append('(');
                first = false;
            } else {
                sb.append(", ");
            }
            sb.append(a);
        }
        if (! first) sb.append(')');
        return sb.toString();
    }

    private static String adaptNull(String s) {
        return (s == null) ? "" : s;
    }

    private static String leftpadFormat(int width) {
        // "%-0s" is, of course, a syntax error, so we have to special-case
        // it, and provide this method.
        return (width == 0) ? "%s" : "%-" + width + "s";
    }

    public static void format(List<HelpLine> lines, Formatter f) {
        /* Compute column width. */
        int headWidth = 0;
        for (HelpLine l : lines) {
            headWidth = Math.max(headWidth, l.getHead().length());
        }
        String lineFormat = leftpadFormat(headWidth) + "  %s";
        /* Print lines */
        boolean firstLine = true;
        for (HelpLine l : lines) {
            if (firstLine) {
                firstLine = false;
            } else {
                f.format("\n");
            }
            String tail = l.getTail();
            if (tail.isEmpty()) {
                f.format("%s", l.getHead());
            } else {
                f.format(lineFormat, l.getHead(), tail);
            }
        }
        /* Done */
        f.flush();
    }

}
