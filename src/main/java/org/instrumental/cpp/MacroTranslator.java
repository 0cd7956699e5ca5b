package org.instrumental.cpp;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates every macro a header defined into Java.
 *
 * This is the final pass over a processed header. Each macro ever
 * defined is visited in order of first definition, with its latest
 * body. Object-like bodies are macro-expanded first, against the
 * macros in effect at the end of the header, unless
 * {@link Feature#EXPAND_MACRO_BODIES} is off. Empty bodies are
 * skipped. A body which is not a supported constant expression is
 * left out and logged; it never fails the run.
 */
public class MacroTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(MacroTranslator.class);

    private final Preprocessor pp;
    @CheckForNull
    private String qualifier;

    public MacroTranslator(@Nonnull Preprocessor pp) {
        this.pp = pp;
    }

    /**
     * Sets the class name references to other macros are qualified
     * with in the generated source.
     */
    public void setQualifier(@CheckForNull String qualifier) {
        this.qualifier = qualifier;
    }

    /* A macro body which parsed as a constant expression. */
    private static class Parsed {

        private final Macro macro;
        private final Macro translated;
        private final CExpression expression;

        private Parsed(@Nonnull Macro macro, @Nonnull Macro translated, @Nonnull CExpression expression) {
            this.macro = macro;
            this.translated = translated;
            this.expression = expression;
        }
    }

    /**
     * Translates the macros of the preprocessor.
     *
     * Bodies are parsed first, so that the type of every macro is
     * known before any source referring to it is generated.
     *
     * @throws LexerException only if a conversion warning is promoted
     * to an error.
     */
    @Nonnull
    public MacroDefinitions translate()
            throws LexerException {
        MacroTable macros = pp.getMacros();
        MacroExpander expander = pp.getExpander();
        boolean expand = pp.getFeature(Feature.EXPAND_MACRO_BODIES);
        CExpressionParser parser = new CExpressionParser();
        Map<String, Parsed> parsed = new LinkedHashMap<String, Parsed>();
        Set<String> functions = new HashSet<String>();

        for (Macro m : macros.getAllMacros()) {
            if (m.isFunctionLike())
                functions.add(m.getName());
            List<Token> body = m.getTokens();
            if (expand && !m.isFunctionLike()) {
                try {
                    body = expander.expand(body);
                } catch (ParseException e) {
                    failed(m, e.getMessage());
                    continue;
                }
            }
            if (isEmpty(body)) {
                if (pp.getFeature(Feature.DEBUG))
                    LOG.debug("Skipping empty macro " + m.getName());
                continue;
            }
            try {
                parsed.put(m.getName(), new Parsed(m, m.withTokens(body), parser.parse(body)));
            } catch (ConvertException e) {
                failed(m, e.getMessage());
            }
        }

        Map<String, JavaType> types = new HashMap<String, JavaType>();
        Set<String> visited = new HashSet<String>();
        for (String name : parsed.keySet())
            resolveType(name, parsed, functions, types, visited);

        MacroDefinitions definitions = new MacroDefinitions();
        for (Parsed p : parsed.values()) {
            Macro m = p.macro;
            try {
                JavaSourceGenerator generator = newGenerator(m, types, functions);
                JavaSourceGenerator.JavaExpression java = generator.generate(p.expression);

                boolean satisfied = true;
                for (String name : p.expression.getNames()) {
                    if (!m.getArgs().contains(name) && !macros.isDefined(name)) {
                        satisfied = false;
                        break;
                    }
                }
                boolean live = macros.getMacro(m.getName()) == m;

                TranspiledMacro entry = new TranspiledMacro(definitions, p.translated,
                        p.expression, generator, java, satisfied, live);
                definitions.add(entry);
                if (pp.getFeature(Feature.DEBUG))
                    LOG.debug("Translated " + entry);
            } catch (ConvertException e) {
                failed(m, e.getMessage());
            }
        }
        return definitions;
    }

    @Nonnull
    private JavaSourceGenerator newGenerator(@Nonnull Macro m, @Nonnull Map<String, JavaType> types,
            @Nonnull Set<String> functions) {
        return new JavaSourceGenerator(qualifier, m.getArgs(), types, functions);
    }

    /**
     * Records the Java type of the named macro, resolving the macros it
     * refers to first. Inside a cycle the reference back is typed long;
     * such entries are never written out.
     */
    private void resolveType(@Nonnull String name, @Nonnull Map<String, Parsed> parsed,
            @Nonnull Set<String> functions, @Nonnull Map<String, JavaType> types,
            @Nonnull Set<String> visited) {
        Parsed p = parsed.get(name);
        if (p == null || !visited.add(name))
            return;
        for (String dep : p.expression.getNames())
            if (!p.macro.getArgs().contains(dep))
                resolveType(dep, parsed, functions, types, visited);
        try {
            types.put(name, newGenerator(p.macro, types, functions).generate(p.expression).getType());
        } catch (ConvertException e) {
            if (pp.getFeature(Feature.DEBUG))
                LOG.debug("No type for " + name + ": " + e.getMessage());
        }
    }

    private static boolean isEmpty(@Nonnull List<Token> body) {
        for (Token tok : body)
            if (!tok.isWhite() && tok.getType() != TokenType.NEWLINE)
                return false;
        return true;
    }

    private void failed(@Nonnull Macro m, @Nonnull String msg)
            throws LexerException {
        String text = "Cannot translate macro " + m.getName() + ": " + msg;
        if (pp.getWarning(Warning.CONVERT))
            pp.warning(m.getLine(), m.getColumn(), text);
        else
            LOG.debug(text);
    }
}
