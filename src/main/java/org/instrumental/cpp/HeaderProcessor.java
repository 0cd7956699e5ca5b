package org.instrumental.cpp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes a header in one call: lexing, preprocessing, writing the
 * cleaned header and translating its macros.
 *
 * A HeaderProcessor holds configuration only; every call to
 * {@link #process(String)} uses a fresh {@link Preprocessor}.
 */
public class HeaderProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(HeaderProcessor.class);

    private final Set<Feature> features = EnumSet.of(Feature.EXPAND_MACRO_BODIES);
    private final Set<Warning> warnings = EnumSet.of(Warning.UNDEF, Warning.DIRECTIVE);
    private final Map<String, String> predefined = new LinkedHashMap<String, String>();
    private List<ReplacementRule> rules = Platform.current().getReplacementRules();
    @CheckForNull
    private PreprocessorListener listener = new DefaultPreprocessorListener();
    @CheckForNull
    private String packageName;
    private String className = "Macros";

    @Nonnull
    public Set<Feature> getFeatures() {
        return features;
    }

    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    public void addFeatures(Feature... f) {
        features.addAll(Arrays.asList(f));
    }

    public void removeFeature(@Nonnull Feature f) {
        features.remove(f);
    }

    @Nonnull
    public Set<Warning> getWarnings() {
        return warnings;
    }

    public void addWarning(@Nonnull Warning w) {
        warnings.add(w);
    }

    public void setPlatform(@Nonnull Platform platform) {
        this.rules = platform.getReplacementRules();
    }

    public void setReplacementRules(@Nonnull List<ReplacementRule> rules) {
        this.rules = new ArrayList<ReplacementRule>(rules);
    }

    /**
     * Sets the listener for warnings, errors and progress.
     *
     * The default is a {@link DefaultPreprocessorListener}.
     */
    public void setListener(@CheckForNull PreprocessorListener listener) {
        this.listener = listener;
    }

    /**
     * Predefines a macro for every subsequent run.
     */
    public void addMacro(@Nonnull String name, @Nonnull String value) {
        predefined.put(name, value);
    }

    public void addMacro(@Nonnull String name) {
        addMacro(name, "1");
    }

    /**
     * Removes a macro predefined with {@link #addMacro(String, String)}.
     */
    public void removeMacro(@Nonnull String name) {
        predefined.remove(name);
    }

    /**
     * Sets the package of the generated Java class, or null for none.
     */
    public void setPackageName(@CheckForNull String packageName) {
        this.packageName = packageName;
    }

    public void setClassName(@Nonnull String className) {
        this.className = className;
    }

    /**
     * Processes the given header text.
     *
     * @throws LexerException if the header cannot be lexed or is
     * structurally broken.
     */
    @Nonnull
    public ProcessedHeader process(@Nonnull String text)
            throws LexerException {
        Preprocessor pp = new Preprocessor();
        pp.getFeatures().clear();
        pp.addFeatures(features);
        pp.getWarnings().clear();
        pp.addWarnings(warnings);
        pp.setReplacementRules(rules);
        pp.setListener(listener);
        for (Map.Entry<String, String> e : predefined.entrySet())
            pp.addMacro(e.getKey(), e.getValue());

        pp.addInput(text);
        pp.process();

        List<Token> tokens = new ArrayList<Token>(pp.getOutput());
        String header = new TokenWriter(pp.getFeature(Feature.MINIFY)).render(tokens);

        MacroTranslator translator = new MacroTranslator(pp);
        translator.setQualifier(className);
        MacroDefinitions definitions = translator.translate();
        String javaSource = new JavaMacroWriter(packageName, className).render(definitions);

        LOG.info("Processed " + tokens.size() + " tokens; translated "
                + definitions.size() + " of " + pp.getMacros().getAllMacros().size() + " macros");
        return new ProcessedHeader(tokens, header, pp.getMacros(), definitions, javaSource);
    }

    /**
     * Processes the given header file, read as UTF-8.
     */
    @Nonnull
    public ProcessedHeader process(@Nonnull File file)
            throws IOException, LexerException {
        if (features.contains(Feature.DEBUG))
            LOG.debug("Reading " + file);
        return process(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    }
}
