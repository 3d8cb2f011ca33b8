package net.optspec.argparse;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link DefinitionParser} */
public class DefinitionParserTest {

    /** A definition using every clause */
    @Test
    public void testFullDefinition() {
        OptionDefinition def = DefinitionParser.parse(
            "-p,--port:number=3000; Port to use");
        Assert.assertEquals(Character.valueOf('p'), def.getShortFlag());
        Assert.assertEquals("port", def.getLongFlag());
        Assert.assertEquals(ValueType.NUMBER, def.getValueType());
        Assert.assertFalse(def.isRequired());
        Assert.assertEquals(3000.0, (Double) def.getDefaultValue(), 0.0);
        Assert.assertEquals("Port to use", def.getDescription());
        Assert.assertTrue(def.hasExplicitDefault());
    }

    /** The shortest possible definition */
    @Test
    public void testMinimalDefinition() {
        OptionDefinition def = DefinitionParser.parse("--a:string");
        Assert.assertNull(def.getShortFlag());
        Assert.assertEquals("a", def.getLongFlag());
        Assert.assertEquals(ValueType.STRING, def.getValueType());
        Assert.assertNull(def.getDefaultValue());
        Assert.assertEquals("", def.getDescription());
        Assert.assertFalse(def.hasExplicitDefault());
    }

    /** Whitespace between grammar elements does not matter */
    @Test
    public void testFlexibleWhitespace() {
        OptionDefinition def = DefinitionParser.parse(
            " -n , --num : number [ ] = [ 1 , 2 ]; bla bla ");
        Assert.assertEquals(Character.valueOf('n'), def.getShortFlag());
        Assert.assertEquals("num", def.getLongFlag());
        Assert.assertEquals(ValueType.NUMBER_ARRAY, def.getValueType());
        Assert.assertEquals(Arrays.asList(1.0, 2.0), def.getDefaultValue());
        Assert.assertEquals("bla bla", def.getDescription());
    }

    /** Every type token maps to its value type and implicit default */
    @Test
    public void testImplicitDefaults() {
        Assert.assertEquals(Boolean.FALSE,
            DefinitionParser.parse("--a:boolean").getDefaultValue());
        Assert.assertNull(
            DefinitionParser.parse("--a:number").getDefaultValue());
        Assert.assertNull(
            DefinitionParser.parse("--a:string").getDefaultValue());
        Assert.assertEquals(Collections.emptyList(),
            DefinitionParser.parse("--a:number[]").getDefaultValue());
        Assert.assertEquals(Collections.emptyList(),
            DefinitionParser.parse("--a:string[]").getDefaultValue());
    }

    @Test
    public void testRequiredMarker() {
        OptionDefinition def = DefinitionParser.parse(
            "-a,--foo:number!; needed");
        Assert.assertTrue(def.isRequired());
        Assert.assertNull(def.getDefaultValue());
        Assert.assertEquals("needed", def.getDescription());
    }

    /** Semicolons and quotes inside quoted defaults do not end them */
    @Test
    public void testQuotedDefaults() {
        OptionDefinition def = DefinitionParser.parse(
            "--a:string=\"; \\\"\"; desc");
        Assert.assertEquals("; \"", def.getDefaultValue());
        Assert.assertEquals("desc", def.getDescription());
        def = DefinitionParser.parse(
            "--a:string[]=[ \"; \\\"\" , \",[,]\" ]");
        Assert.assertEquals(Arrays.asList("; \"", ",[,]"),
                            def.getDefaultValue());
        def = DefinitionParser.parse("--a:string=\"two  spaces\"");
        Assert.assertEquals("two  spaces", def.getDefaultValue());
    }

    /** Descriptions are free text, quotes included */
    @Test
    public void testDescriptionText() {
        OptionDefinition def = DefinitionParser.parse(
            "--baz:string; piyopiyo\"");
        Assert.assertEquals("piyopiyo\"", def.getDescription());
        def = DefinitionParser.parse("--baz:string;a; b");
        Assert.assertEquals("a; b", def.getDescription());
    }

    /** Malformed definitions are configuration errors */
    @Test
    public void testSyntaxErrors() {
        for (String s : new String[] {
                "", "a:string", "-a:string", "--:string", "--a",
                "--a:", "ab,--a:string", "-a--b:string", "--a-b:string",
                "--a:string?", "--a:strings", "--a:number[][]"}) {
            try {
                DefinitionParser.parse(s);
                Assert.fail("Expected SettingsException for " + s);
            } catch (SettingsException exc) {
                Assert.assertEquals(s, exc.getDefinition());
            }
        }
    }

    @Test
    public void testUnknownType() {
        try {
            DefinitionParser.parse("--a:integer");
            Assert.fail("Expected SettingsException");
        } catch (SettingsException exc) {
            Assert.assertTrue(exc.getMessage().contains("integer"));
        }
    }

    /** Required options cannot have defaults, whichever comes first */
    @Test
    public void testRequiredWithDefault() {
        for (String s : new String[] {"--a:number!=1", "--a:number=1!",
                                      "--a:string[]=[\"x\"]!"}) {
            try {
                DefinitionParser.parse(s);
                Assert.fail("Expected SettingsException for " + s);
            } catch (SettingsException exc) {
                Assert.assertTrue(exc.getMessage().contains("required"));
            }
        }
    }

    @Test
    public void testAliasFormatting() {
        OptionDefinition def = DefinitionParser.parse("-a,--foo:boolean");
        Assert.assertEquals("-a, --foo", def.formatAliases());
        Assert.assertEquals(Arrays.asList("-a", "--foo"), def.getAliases());
        def = DefinitionParser.parse("--foo:boolean");
        Assert.assertEquals("--foo", def.formatAliases());
        Assert.assertEquals(Arrays.asList("--foo"), def.getAliases());
    }

}
