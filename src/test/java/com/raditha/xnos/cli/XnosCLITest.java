package com.raditha.xnos.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XnosCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private PrintStream originalOut;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        originalOut = System.out;
        System.setOut(new PrintStream(outContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("documents/" + name)) {
            assertNotNull(in);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    private static int execute(XnosCLI app, String... args) {
        return XnosCLI.createCommandLine(app).execute(args);
    }

    private static XnosCLI withoutEnvironment() {
        XnosCLI app = new XnosCLI();
        app.setEnvironment(Map.of());
        return app;
    }

    @Test
    void testFileToFile() throws IOException {
        Path in = copyFixture("references-2.11.json");
        Path out = tempDir.resolve("out.json");

        int exitCode = execute(withoutEnvironment(), "html5", "--input", in.toString(), "--output", out.toString(),
                "--warning-level", "0");

        assertEquals(0, exitCode);
        JsonNode result = new ObjectMapper().readTree(out.toFile());
        assertEquals("#fig:plot", result.at("/blocks/4/c/2/c/2/0").asText());
        assertEquals("", outContent.toString());
    }

    @Test
    void testStandardOutput() throws IOException {
        Path in = copyFixture("references-2.11.json");

        int exitCode = execute(withoutEnvironment(), "latex", "--input", in.toString(), "--warning-level", "0");

        assertEquals(0, exitCode);
        JsonNode result = new ObjectMapper().readTree(outContent.toString(StandardCharsets.UTF_8));
        assertEquals("RawBlock", result.at("/blocks/0/t").asText());
    }

    @Test
    void testNoFakeryOption() throws IOException {
        Path in = copyFixture("references-2.11.json");

        int exitCode = execute(withoutEnvironment(), "latex", "--input", in.toString(), "--no-fakery", "--cleveref",
                "--warning-level", "0");

        assertEquals(0, exitCode);
        JsonNode result = new ObjectMapper().readTree(outContent.toString(StandardCharsets.UTF_8));
        assertEquals("Header", result.at("/blocks/0/t").asText());
        assertEquals("\\cref{fig:plot}", result.at("/blocks/4/c/2/c/1").asText());
    }

    @Test
    void testVersionFromEnvironment() throws IOException {
        Path in = copyFixture("references-1.17.json");
        XnosCLI app = new XnosCLI();
        app.setEnvironment(Map.of("PANDOC_VERSION", "1.16"));

        int exitCode = execute(app, "html", "--input", in.toString());

        assertEquals(0, exitCode);
        JsonNode result = new ObjectMapper().readTree(outContent.toString(StandardCharsets.UTF_8));
        assertEquals("#fig:a", result.at("/1/1/c/2/c/2/0").asText());
    }

    @Test
    void testCustomConfigFile() throws IOException {
        Path in = copyFixture("references-2.11.json");
        Path config = tempDir.resolve("xnos.yml");
        Files.writeString(config, """
                xnos:
                  warning_level: 0
                  targets:
                    - kind: math
                      prefix: eq
                      plus_name: [Eq., Eqs.]
                      allow_space: true
                """);

        int exitCode = execute(withoutEnvironment(), "plain", "--input", in.toString(),
                "--config-file", config.toString());

        assertEquals(0, exitCode);
        JsonNode result = new ObjectMapper().readTree(outContent.toString(StandardCharsets.UTF_8));
        JsonNode refs = result.at("/blocks/4/c");
        // figures are not configured, so the figure reference stays a citation
        assertEquals("Cite", refs.at("/2/t").asText());
        assertEquals("Eq.\u00A0", refs.at("/5/c").asText());
        assertEquals("1", refs.at("/6/c").asText());
    }

    @Property(tries = 100)
    void optionsAreParsed(@ForAll("formats") String format,
            @ForAll @IntRange(min = 0, max = 2) int warningLevel,
            @ForAll boolean cleveref,
            @ForAll boolean noFakery,
            @ForAll("versions") String version) {
        List<String> args = new ArrayList<>();
        args.add(format);
        args.add("--warning-level");
        args.add(String.valueOf(warningLevel));
        if (cleveref) {
            args.add("--cleveref");
        }
        if (noFakery) {
            args.add("--no-fakery");
        }
        args.add("--pandoc-version");
        args.add(version);

        CommandLine.ParseResult result = new CommandLine(new XnosCLI()).parseArgs(args.toArray(new String[0]));

        assertEquals(format, result.matchedPositionalValue(0, null));
        assertEquals(Integer.valueOf(warningLevel), result.matchedOptionValue("--warning-level", null));
        assertEquals(cleveref, result.hasMatchedOption("--cleveref"));
        assertEquals(noFakery, result.hasMatchedOption("--no-fakery"));
        assertEquals(version, result.matchedOptionValue("--pandoc-version", null));
    }

    @Provide
    Arbitrary<String> formats() {
        return Arbitraries.of("html", "html5", "latex", "beamer", "epub3", "docx", "plain", "markdown+smart");
    }

    @Provide
    Arbitrary<String> versions() {
        return Arbitraries.oneOf(
                Arbitraries.of("1.15", "1.17.2", "2.9.2.1", "2.10", "2.11.4", "3.1"),
                Arbitraries.integers().between(0, 19).map(minor -> "2." + minor));
    }
}
