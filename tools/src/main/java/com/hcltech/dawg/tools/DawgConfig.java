package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.IEnvGetter;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of the command line runner.
 *
 * @param lexicon      file path or classpath resource holding one word per line
 * @param verbose      log minimization progress
 * @param dump         print the minimized graph after the report
 * @param words        print every recognized word, one per line, after the report
 * @param progressStep fraction of progress between two logged progress lines
 */
public record DawgConfig(String lexicon, boolean verbose, boolean dump, boolean words, double progressStep) {

    public static final String DEFAULTS_RESOURCE = "dawg.properties";
    public static final String LEXICON = "dawg.lexicon";
    public static final String VERBOSE = "dawg.verbose";
    public static final String DUMP = "dawg.dump";
    public static final String WORDS = "dawg.words";
    public static final String PROGRESS_STEP = "dawg.progress.step";

    public DawgConfig {
        Objects.requireNonNull(lexicon, "lexicon");
        if (lexicon.isBlank()) throw new IllegalArgumentException("lexicon cannot be blank");
        if (!(progressStep > 0 && progressStep <= 1)) {
            throw new IllegalArgumentException("progressStep must be in (0, 1] but was " + progressStep);
        }
    }

    /** Environment ({@code DAWG_LEXICON}) wins over system properties ({@code dawg.lexicon}), which win over {@code dawg.properties}. */
    public static DawgConfig fromSystem() {
        return from(IEnvGetter.env, System::getProperty, loadDefaults(DEFAULTS_RESOURCE));
    }

    public static DawgConfig from(IEnvGetter env, IEnvGetter systemProperties, Properties defaults) {
        IEnvGetter envByKey = key -> env.get(IEnvGetter.toEnvKey(key));
        return from(envByKey.orElse(systemProperties).orElse(IEnvGetter.fromProperties(defaults)));
    }

    public static DawgConfig from(IEnvGetter source) {
        return new DawgConfig(
                IEnvGetter.getString(source, LEXICON),
                IEnvGetter.getBooleanOr(source, VERBOSE, false),
                IEnvGetter.getBooleanOr(source, DUMP, false),
                IEnvGetter.getBooleanOr(source, WORDS, false),
                IEnvGetter.getDoubleOr(source, PROGRESS_STEP, 0.1));
    }

    public DawgConfig withLexicon(String lexicon) {
        return new DawgConfig(lexicon, verbose, dump, words, progressStep);
    }

    static Properties loadDefaults(String resource) {
        Properties defaults = new Properties();
        try (InputStream is = DawgConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) defaults.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
        return defaults;
    }
}
