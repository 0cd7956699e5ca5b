package org.instrumental.cpp;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MacroTranslatorTest {

    private static final String HEADER = ""
            + "#define WIDTH 640\n"
            + "#define HEIGHT (WIDTH * 3 / 4)\n"
            + "#define AREA (WIDTH * HEIGHT)\n"
            + "#define NAME \"camera\"\n"
            + "#define RATE 2.5\n"
            + "#define ENABLED (WIDTH > 100)\n"
            + "#define LOW_BYTE(x) ((x) & 0xFF)\n"
            + "#define SCALE(x) ((x) * WIDTH)\n"
            + "#define EMPTY\n"
            + "#define STMT do { } while (0)\n"
            + "#define MISSING_DEP (UNKNOWN + 1)\n"
            + "#define GONE 7\n"
            + "#undef GONE\n";

    private static Preprocessor preprocess(String text, boolean expand) throws LexerException {
        Preprocessor pp = new Preprocessor();
        pp.setReplacementRules(Collections.<ReplacementRule>emptyList());
        if (!expand)
            pp.getFeatures().remove(Feature.EXPAND_MACRO_BODIES);
        pp.process(text);
        return pp;
    }

    private static MacroDefinitions translate(String text, boolean expand) throws LexerException {
        return new MacroTranslator(preprocess(text, expand)).translate();
    }

    @Test
    void testObjectMacroValues() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        assertEquals(Long.valueOf(640), defs.get("WIDTH").getValue());
        assertEquals(Long.valueOf(480), defs.get("HEIGHT").getValue());
        assertEquals(Long.valueOf(307200), defs.get("AREA").getValue());
        assertEquals("camera", defs.get("NAME").getValue());
        assertEquals(JavaType.STRING, defs.get("NAME").getJavaType());
        assertEquals(Double.valueOf(2.5), defs.get("RATE").getValue());
        assertEquals(Boolean.TRUE, defs.get("ENABLED").getValue());
        assertEquals(JavaType.BOOLEAN, defs.get("ENABLED").getJavaType());
    }

    @Test
    void testExpandedBodiesHaveNoDependencies() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        TranspiledMacro height = defs.get("HEIGHT");
        assertEquals("((640L * 3L) / 4L)", height.getJavaSource());
        assertTrue(height.getDependencies().isEmpty());
        assertEquals("(640*3/4)", height.getMacro().getText().replace(" ", ""));
    }

    @Test
    void testUnexpandedBodiesKeepDependencies() throws Exception {
        MacroDefinitions defs = translate(HEADER, false);
        TranspiledMacro area = defs.get("AREA");
        assertEquals(new LinkedHashSet<String>(Arrays.asList("WIDTH", "HEIGHT")), area.getDependencies());
        assertTrue(area.isDependenciesSatisfied());
        assertEquals("(WIDTH * HEIGHT)", area.getJavaSource());
        assertEquals(Long.valueOf(307200), area.getValue());
    }

    @Test
    void testFunctionMacros() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        TranspiledMacro lowByte = defs.get("LOW_BYTE");
        assertTrue(lowByte.isFunctionLike());
        assertEquals("(x & 0xFFL)", lowByte.getJavaSource());
        assertEquals(Long.valueOf(0x34), lowByte.call(0x1234));

        TranspiledMacro scale = defs.get("SCALE");
        assertEquals(Collections.singleton("WIDTH"), scale.getDependencies());
        assertEquals(Long.valueOf(1280), scale.call(Long.valueOf(2)));

        ConvertException e = assertThrows(ConvertException.class, () -> scale.call(1, 2));
        assertTrue(e.getMessage().contains("has 1 parameters but given 2 args"), e.getMessage());
        assertThrows(IllegalStateException.class, () -> scale.getValue());
        assertThrows(IllegalStateException.class, () -> defs.get("WIDTH").call());
    }

    @Test
    void testUntranslatableMacrosAreLeftOut() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        assertNull(defs.get("EMPTY"));
        assertNull(defs.get("STMT"));
        assertEquals(10, defs.size());
    }

    @Test
    void testUnsatisfiedDependencies() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        TranspiledMacro missing = defs.get("MISSING_DEP");
        assertFalse(missing.isDependenciesSatisfied());
        assertTrue(missing.toString().startsWith("// "), missing.toString());
        ConvertException e = assertThrows(ConvertException.class, () -> missing.getValue());
        assertEquals("No definition for UNKNOWN", e.getMessage());
    }

    @Test
    void testUndefinedMacroIsNotLive() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        assertTrue(defs.get("WIDTH").isLive());
        assertFalse(defs.get("GONE").isLive());
        assertEquals(Long.valueOf(7), defs.get("GONE").getValue());
    }

    @Test
    void testLatestDefinitionIsTranslated() throws Exception {
        MacroDefinitions defs = translate("#define V 1\n#define V 2\n", true);
        assertEquals(1, defs.size());
        assertEquals(Long.valueOf(2), defs.get("V").getValue());
    }

    @Test
    void testForwardReferencesAreTyped() throws Exception {
        MacroDefinitions defs = translate("#define SCALED(x) ((x) * SCALE)\n#define SCALE 2.5\n", true);
        TranspiledMacro scaled = defs.get("SCALED");
        assertEquals(JavaType.DOUBLE, scaled.getJavaType());
        assertEquals("(x * SCALE)", scaled.getJavaSource());
        assertEquals(Double.valueOf(5.0), scaled.call(2));

        defs = translate("#define HALF (RATIO / 2)\n#define NAMED LABEL\n#define RATIO 3.0\n#define LABEL \"l\"\n", false);
        assertEquals(JavaType.DOUBLE, defs.get("HALF").getJavaType());
        assertEquals(Double.valueOf(1.5), defs.get("HALF").getValue());
        assertEquals(JavaType.STRING, defs.get("NAMED").getJavaType());
        assertEquals("l", defs.get("NAMED").getValue());
    }

    @Test
    void testFunctionMacroNameWithoutArgumentsIsLeftOut() throws Exception {
        Preprocessor pp = preprocess("#define F(x) ((x) + 1)\n#define G F\n#define H F(2)\n", true);
        pp.addWarning(Warning.CONVERT);
        DefaultPreprocessorListener listener = new DefaultPreprocessorListener();
        pp.setListener(listener);
        MacroDefinitions defs = new MacroTranslator(pp).translate();
        assertNotNull(defs.get("F"));
        assertNull(defs.get("G"));
        assertEquals(Long.valueOf(3), defs.get("H").getValue());
        assertEquals(Collections.singletonList(
                "Cannot translate macro G: Function-like macro F used without arguments"), listener.getWarnings());
    }

    @Test
    void testRecursiveDefinitions() throws Exception {
        MacroDefinitions defs = translate("#define R1 R2\n#define R2 R1\n", false);
        ConvertException e = assertThrows(ConvertException.class, () -> defs.get("R1").getValue());
        assertTrue(e.getMessage().startsWith("Recursive definition of "), e.getMessage());
    }

    @Test
    void testConversionWarnings() throws Exception {
        Preprocessor pp = preprocess(HEADER, true);
        pp.addWarning(Warning.CONVERT);
        DefaultPreprocessorListener listener = new DefaultPreprocessorListener();
        pp.setListener(listener);
        new MacroTranslator(pp).translate();
        assertEquals(1, listener.getWarnings().size());
        assertTrue(listener.getWarnings().get(0).startsWith("Cannot translate macro STMT: "),
                listener.getWarnings().get(0));
    }

    @Test
    void testQualifier() throws Exception {
        MacroTranslator translator = new MacroTranslator(preprocess(HEADER, false));
        translator.setQualifier("Camera");
        MacroDefinitions defs = translator.translate();
        assertEquals("(x * Camera.WIDTH)", defs.get("SCALE").getJavaSource());
    }

    @Test
    void testJson() throws Exception {
        MacroDefinitions defs = translate(HEADER, true);
        JsonArray json = JsonParser.parseString(defs.toJsonString()).getAsJsonArray();
        assertEquals(defs.size(), json.size());

        JsonObject width = json.get(0).getAsJsonObject();
        assertEquals("WIDTH", width.get("name").getAsString());
        assertEquals("640", width.get("body").getAsString());
        assertEquals("long", width.get("type").getAsString());
        assertEquals(640, width.get("value").getAsLong());
        assertTrue(width.get("live").getAsBoolean());

        JsonObject scale = defs.get("SCALE").toJson();
        assertEquals("x", scale.getAsJsonArray("params").get(0).getAsString());
        assertFalse(scale.has("value"));

        JsonObject missing = defs.get("MISSING_DEP").toJson();
        assertFalse(missing.get("dependenciesSatisfied").getAsBoolean());
        assertFalse(missing.has("value"));
    }

    @Test
    void testJsonReportsEvaluationErrors() throws Exception {
        MacroDefinitions defs = translate("#define BAD (1 / 0)\n", true);
        JsonObject bad = defs.get("BAD").toJson();
        assertEquals("Division by zero", bad.get("error").getAsString());
    }
}
