package net.optspec.argparse;

import java.util.ArrayList;
import java.util.Formatter;
import java.util.List;
import net.optspec.util.Util;

/**
 * Renders option definitions as help text.
 * <p>
 * The output consists of an optional usage line followed by one line per
 * option, e.g.
 * <pre>
 * Usage: serve [&lt;options&gt;] &lt;paths&gt;...
 * -p, --port &lt;number&gt;     Port to use (default: 3000)
 * -a, --address &lt;string&gt;  Address to use (default: "0.0.0.0")
 *     --cors              Enable CORS
 * </pre>
 */
public final class HelpFormatter {

    public static final String USAGE_LINE_HEADER = "Usage: ";
    public static final String DEFAULT_PREFIX = "default: ";
    public static final String REQUIRED_ADDENDUM = "required";

    /* Width of a "-x, " prefix, used to align lone long flags. */
    private static final String SHORT_PADDING = "    ";

    private HelpFormatter() {}

    public static HelpLine getHelpLine(OptionDefinition def) {
        String name = (def.getShortFlag() == null) ?
            SHORT_PADDING + def.formatLongFlag() : def.formatAliases();
        String params = (def.getValueType() == ValueType.BOOLEAN) ? null :
            "<" + def.getValueType().getToken() + ">";
        HelpLine ret = new HelpLine(name, params, def.getDescription());
        if (def.isRequired()) {
            ret.addAddendum(REQUIRED_ADDENDUM);
        } else if (def.hasExplicitDefault()) {
            ret.addAddendum(DEFAULT_PREFIX +
                            Util.formatJSON(def.getDefaultValue()));
        }
        return ret;
    }

    public static List<HelpLine> getHelpLines(DefinitionSet defs) {
        List<HelpLine> ret = new ArrayList<HelpLine>();
        for (OptionDefinition d : defs.getDefinitions().values())
            ret.add(getHelpLine(d));
        return ret;
    }

    public static String formatUsageLine(String usage) {
        return USAGE_LINE_HEADER + usage;
    }

    /**
     * Format help for the given definitions.
     *
     * @param usage The usage synopsis, or null to omit the usage line.
     * @param defs  The options to describe.
     */
    public static String format(String usage, DefinitionSet defs) {
        StringBuilder sb = new StringBuilder();
        if (usage != null) sb.append(formatUsageLine(usage));
        List<HelpLine> lines = getHelpLines(defs);
        if (! lines.isEmpty()) {
            if (sb.length() != 0) sb.append('\n');
            HelpLine.format(lines, new Formatter(sb, null));
        }
        return sb.toString();
    }

}
