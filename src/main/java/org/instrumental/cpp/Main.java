/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.instrumental.cpp;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nonnull;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes one header from the command line, writing the cleaned
 * header and, on request, the translated macros as a Java class or as
 * JSON.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Nonnull
    private static CharSequence getWarnings() {
        StringBuilder buf = new StringBuilder();
        for (Warning w : Warning.values()) {
            if (buf.length() > 0)
                buf.append(", ");
            String name = w.name().toLowerCase();
            buf.append(name.replace('_', '-'));
        }
        return buf;
    }

    public static void main(String[] args) throws Exception {
        int status = new Main().run(args, System.out);
        if (status != 0)
            System.exit(status);
    }

    /**
     * Runs the command line.
     *
     * @param out receives the cleaned header when no output file is given.
     * @return 0 on success, 1 if the header could not be processed, 2 on
     * a usage error.
     */
    public int run(@Nonnull String[] args, @Nonnull PrintStream out)
            throws IOException {

        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");

        OptionSpec<File> outputOption = parser.acceptsAll(Arrays.asList("output", "o"),
                "Writes the cleaned header to file instead of standard output.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<File> macrosOption = parser.accepts("macros",
                "Writes the translated macros to file as a Java class.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<File> jsonOption = parser.accepts("json",
                "Writes the translated macros to file as JSON.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<?> minifyOption = parser.accepts("minify",
                "Drops whitespace, comments and most newlines from the header.");
        OptionSpec<?> keepDefinesOption = parser.accepts("keep-defines",
                "Copies #define and #undef lines to the header.");
        OptionSpec<?> noExpandOption = parser.accepts("no-expand-bodies",
                "Translates macro bodies without expanding them first.");
        OptionSpec<String> platformOption = parser.accepts("platform",
                "Selects the type replacements of a platform (windows, linux, darwin).")
                .withRequiredArg().ofType(String.class).describedAs("platform");
        OptionSpec<String> packageOption = parser.accepts("package",
                "Package of the generated Java class.")
                .withRequiredArg().ofType(String.class).describedAs("package");
        OptionSpec<String> classOption = parser.accepts("class",
                "Name of the generated Java class.")
                .withRequiredArg().ofType(String.class).describedAs("name").defaultsTo("Macros");

        OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
                "Defines the given macro.")
                .withRequiredArg().ofType(String.class).describedAs("name[=definition]");
        OptionSpec<String> undefineOption = parser.acceptsAll(Arrays.asList("undefine", "U"),
                "Undefines the given macro, previously defined using -D.")
                .withRequiredArg().describedAs("name");
        OptionSpec<String> warningOption = parser.acceptsAll(Arrays.asList("warning", "W"),
                "Enables the named warning class (" + getWarnings() + ").")
                .withRequiredArg().ofType(String.class).describedAs("warning");
        OptionSpec<Void> noWarningOption = parser.acceptsAll(Arrays.asList("no-warnings", "w"),
                "Disables ALL warnings.");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Header to process.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            LOG.error(e.getMessage());
            parser.printHelpOn(System.err);
            return 2;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return 0;
        }

        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.size() != 1) {
            LOG.error("Expected exactly one header, got " + inputs.size());
            parser.printHelpOn(System.err);
            return 2;
        }

        HeaderProcessor processor = new HeaderProcessor();
        processor.setListener(new DefaultPreprocessorListener());

        if (options.has(debugOption))
            processor.addFeature(Feature.DEBUG);
        if (options.has(minifyOption))
            processor.addFeature(Feature.MINIFY);
        if (options.has(keepDefinesOption))
            processor.addFeature(Feature.KEEP_DEFINES);
        if (options.has(noExpandOption))
            processor.removeFeature(Feature.EXPAND_MACRO_BODIES);

        if (options.has(noWarningOption))
            processor.getWarnings().clear();

        try {
            for (String warning : options.valuesOf(warningOption)) {
                warning = warning.toUpperCase();
                warning = warning.replace('-', '_');
                if (warning.equals("ALL"))
                    processor.getWarnings().addAll(EnumSet.allOf(Warning.class));
                else
                    processor.addWarning(Enum.valueOf(Warning.class, warning));
            }
            if (options.has(platformOption))
                processor.setPlatform(Platform.forName(options.valueOf(platformOption)));
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            return 2;
        }

        for (String arg : options.valuesOf(defineOption)) {
            int idx = arg.indexOf('=');
            if (idx == -1)
                processor.addMacro(arg);
            else
                processor.addMacro(arg.substring(0, idx), arg.substring(idx + 1));
        }
        for (String arg : options.valuesOf(undefineOption)) {
            processor.removeMacro(arg);
        }

        if (options.has(packageOption))
            processor.setPackageName(options.valueOf(packageOption));
        processor.setClassName(options.valueOf(classOption));

        File input = inputs.get(0);
        ProcessedHeader result;
        try {
            result = processor.process(input);
        } catch (LexerException e) {
            LOG.error("Preprocessor failed: " + input + ": " + e.getMessage(), e);
            return 1;
        }

        if (options.has(outputOption))
            FileUtils.writeStringToFile(options.valueOf(outputOption), result.getHeader(), StandardCharsets.UTF_8);
        else
            out.print(result.getHeader());
        if (options.has(macrosOption))
            FileUtils.writeStringToFile(options.valueOf(macrosOption), result.getJavaSource(), StandardCharsets.UTF_8);
        if (options.has(jsonOption))
            FileUtils.writeStringToFile(options.valueOf(jsonOption), result.getDefinitions().toJsonString(), StandardCharsets.UTF_8);
        return 0;
    }
}
