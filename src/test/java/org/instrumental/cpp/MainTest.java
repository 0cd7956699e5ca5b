package org.instrumental.cpp;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final String HEADER = ""
            + "#define LIMIT 16\n"
            + "#define TWICE(x) ((x) * 2)\n"
            + "#ifdef FEATURE\n"
            + "int feature_level = FEATURE;\n"
            + "#endif\n"
            + "int table[LIMIT];  /* storage */\n";

    @TempDir
    File dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private File header(String text) throws IOException {
        File file = new File(dir, "test.h");
        FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
        return file;
    }

    private int run(String... args) throws IOException {
        PrintStream out = new PrintStream(buffer, true, "UTF-8");
        return new Main().run(args, out);
    }

    private String output() {
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void testHelp() throws Exception {
        assertEquals(0, run("--help"));
        assertTrue(output().contains("--minify"), output());
        assertTrue(output().contains("--platform"), output());
    }

    @Test
    void testUsageErrors() throws Exception {
        assertEquals(2, run());
        assertEquals(2, run("--bogus", header(HEADER).getPath()));
        assertEquals(2, run("a.h", "b.h"));
        assertEquals(2, run("-W", "nonsense", header(HEADER).getPath()));
        assertEquals(2, run("--platform", "plan9", header(HEADER).getPath()));
    }

    @Test
    void testHeaderToStandardOutput() throws Exception {
        assertEquals(0, run(header(HEADER).getPath()));
        assertEquals("int table[16];  /* storage */\n", output());
    }

    @Test
    void testDefinesAndMinify() throws Exception {
        File out = new File(dir, "out.h");
        assertEquals(0, run("--minify", "-D", "FEATURE=3", "-o", out.getPath(), header(HEADER).getPath()));
        assertEquals("", output());
        assertEquals("int feature_level=3;\nint table[16];\n", FileUtils.readFileToString(out, StandardCharsets.UTF_8));
    }

    @Test
    void testUndefine() throws Exception {
        assertEquals(0, run("-DFEATURE", "-UFEATURE", header(HEADER).getPath()));
        assertFalse(output().contains("feature_level"), output());
    }

    @Test
    void testKeepDefines() throws Exception {
        assertEquals(0, run("--keep-defines", "--minify", header(HEADER).getPath()));
        assertTrue(output().startsWith("#define LIMIT 16\n#define TWICE(x)((x)*2)\n"), output());
    }

    @Test
    void testMacroOutputs() throws Exception {
        File java = new File(dir, "Limits.java");
        File json = new File(dir, "limits.json");
        assertEquals(0, run("--macros", java.getPath(), "--json", json.getPath(),
                "--package", "org.example", "--class", "Limits", header(HEADER).getPath()));

        String source = FileUtils.readFileToString(java, StandardCharsets.UTF_8);
        assertTrue(source.contains("package org.example;"), source);
        assertTrue(source.contains("public final class Limits {"), source);
        assertTrue(source.contains("public static final long LIMIT = 16L;"), source);
        assertTrue(source.contains("public static long TWICE(long x) {"), source);

        JsonArray entries = JsonParser.parseString(FileUtils.readFileToString(json, StandardCharsets.UTF_8))
                .getAsJsonArray();
        assertEquals(2, entries.size());
        assertEquals("LIMIT", entries.get(0).getAsJsonObject().get("name").getAsString());
        assertEquals(16, entries.get(0).getAsJsonObject().get("value").getAsInt());
    }

    @Test
    void testPlatform() throws Exception {
        assertEquals(0, run("--platform", "windows", "--minify", header("unsigned __int64 big;\n").getPath()));
        assertEquals("uint64_t big;\n", output());
    }

    @Test
    void testWarningsAsErrors() throws Exception {
        File file = header("#if MISSING\n#endif\nint x;\n");
        assertEquals(0, run(file.getPath()));
        assertEquals(1, run("-W", "error", file.getPath()));
        assertEquals(0, run("-w", "-W", "error", file.getPath()),
                "Without the undef warning there is nothing to promote");
    }

    @Test
    void testBrokenHeader() throws Exception {
        assertEquals(1, run(header("#if 1\nint x;\n").getPath()));
        assertEquals(1, run(header("int @x;\n").getPath()));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> run(new File(dir, "missing.h").getPath()));
    }
}
