package org.instrumental.cpp;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class HeaderProcessorTest {

    private static final String HEADER = ""
            + "/* Camera interface */\n"
            + "#ifndef CAMERA_H\n"
            + "#define CAMERA_H\n"
            + "#include <stdint.h>\n"
            + "\n"
            + "#define CAM_MAX_WIDTH 1280\n"
            + "#define CAM_MAX_HEIGHT (CAM_MAX_WIDTH * 3 / 4)\n"
            + "#define CAM_PIXELS(w, h) ((w) * (h))\n"
            + "\n"
            + "#ifdef _WIN32\n"
            + "#define CAM_API __stdcall\n"
            + "#else\n"
            + "#define CAM_API\n"
            + "#endif\n"
            + "\n"
            + "typedef struct {\n"
            + "    int width;   // pixels\n"
            + "    int height;\n"
            + "} cam_size;\n"
            + "\n"
            + "int CAM_API cam_open(int id, cam_size *size);\n"
            + "#endif\n";

    private static HeaderProcessor newProcessor() {
        HeaderProcessor processor = new HeaderProcessor();
        processor.setReplacementRules(Collections.<ReplacementRule>emptyList());
        return processor;
    }

    @Test
    void testProcess() throws Exception {
        ProcessedHeader result = newProcessor().process(HEADER);

        String header = result.getHeader();
        assertTrue(header.contains("int  cam_open(int id, cam_size *size);"), header);
        assertTrue(header.contains("    int width;   // pixels\n"), header);
        assertFalse(header.contains("#define"), header);
        assertFalse(header.contains("#include"), header);

        assertNotNull(result.getMacros().getMacro("CAM_API"));
        assertNotNull(result.getMacros().getMacro("CAMERA_H"));

        MacroDefinitions defs = result.getDefinitions();
        assertEquals(Long.valueOf(960), defs.get("CAM_MAX_HEIGHT").getValue());
        assertEquals(Long.valueOf(12), defs.get("CAM_PIXELS").call(3, 4));
        assertNull(defs.get("CAM_API"), "Empty macros are not translated");

        String java = result.getJavaSource();
        assertTrue(java.contains("public final class Macros {"), java);
        assertTrue(java.contains("public static final long CAM_MAX_WIDTH = 1280L;"), java);
        assertTrue(java.contains("public static long CAM_PIXELS(long w, long h) {"), java);
    }

    @Test
    void testPredefinedMacros() throws Exception {
        HeaderProcessor processor = newProcessor();
        processor.addMacro("_WIN32");
        ProcessedHeader result = processor.process(HEADER);
        assertTrue(result.getHeader().contains("int __stdcall cam_open"), result.getHeader());

        processor.removeMacro("_WIN32");
        result = processor.process(HEADER);
        assertFalse(result.getHeader().contains("__stdcall"), result.getHeader());
    }

    @Test
    void testMinify() throws Exception {
        HeaderProcessor processor = newProcessor();
        processor.addFeature(Feature.MINIFY);
        ProcessedHeader result = processor.process(HEADER);
        assertEquals("typedef struct{int width;\nint height;\n}cam_size;\nint cam_open(int id,cam_size*size);\n",
                result.getHeader());
    }

    @Test
    void testKeepDefines() throws Exception {
        HeaderProcessor processor = newProcessor();
        processor.addFeatures(Feature.KEEP_DEFINES, Feature.MINIFY);
        ProcessedHeader result = processor.process("#define A 1\nint x = A;\n");
        assertEquals("#define A 1\nint x=1;\n", result.getHeader());
    }

    @Test
    void testPlatformReplacements() throws Exception {
        HeaderProcessor processor = newProcessor();
        processor.setPlatform(Platform.WINDOWS);
        processor.addFeature(Feature.MINIFY);
        assertEquals("uint16_t a;\n", processor.process("unsigned __int16 a;\n").getHeader());

        processor.setPlatform(Platform.LINUX);
        assertEquals("unsigned __int16 a;\n", processor.process("unsigned __int16 a;\n").getHeader());
    }

    @Test
    void testPackageAndClassName() throws Exception {
        HeaderProcessor processor = newProcessor();
        processor.setPackageName("org.example.camera");
        processor.setClassName("CameraMacros");
        String java = processor.process("#define A 1\n#define B (A + 1)\n").getJavaSource();
        assertTrue(java.contains("package org.example.camera;"), java);
        assertTrue(java.contains("public final class CameraMacros {"), java);
        assertTrue(java.contains("public static final long B = (1L + 1L);"), java);
    }

    @Test
    void testErrorsAbortProcessing() {
        assertThrows(ParseException.class, () -> newProcessor().process("#if 1\nint x;\n"));
        assertThrows(LexerException.class, () -> newProcessor().process("int @x;\n"));
    }

    @Test
    void testWarningsDoNotAbort() throws Exception {
        DefaultPreprocessorListener listener = new DefaultPreprocessorListener();
        HeaderProcessor processor = newProcessor();
        processor.setListener(listener);
        processor.process("#if UNDEFINED_THING\nint x;\n#endif\n#warning check this\n");
        assertEquals(2, listener.getWarnings().size());
        assertEquals(0, listener.getErrors());
    }

    @Test
    void testWarningsCanBeDisabled() throws Exception {
        DefaultPreprocessorListener listener = new DefaultPreprocessorListener();
        HeaderProcessor processor = newProcessor();
        processor.setListener(listener);
        processor.getWarnings().clear();
        processor.process("#if UNDEFINED_THING\nint x;\n#endif\n#warning check this\n");
        assertTrue(listener.getWarnings().isEmpty());
    }

    @Test
    void testProcessFile(@TempDir File dir) throws Exception {
        File file = new File(dir, "camera.h");
        FileUtils.writeStringToFile(file, HEADER, StandardCharsets.UTF_8);
        ProcessedHeader result = newProcessor().process(file);
        assertEquals(newProcessor().process(HEADER).getHeader(), result.getHeader());
        assertFalse(result.getTokens().isEmpty());
    }
}
