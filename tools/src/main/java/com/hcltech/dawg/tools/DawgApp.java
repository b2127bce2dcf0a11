package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.codec.Codec;
import com.hcltech.dawg.common.codec.JacksonTypedJsonCodec;
import com.hcltech.dawg.common.errorsor.ErrorsOr;
import com.hcltech.dawg.common.metrics.InMemoryMetrics;
import com.hcltech.dawg.graph.GraphStats;
import com.hcltech.dawg.graph.Minimizer;
import com.hcltech.dawg.graph.ProgressListener;
import com.hcltech.dawg.graph.WordGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a minimal word graph from a lexicon and prints a JSON report.
 * <p>
 * Usage: {@code DawgApp [lexicon]}. The lexicon holds one word per line, or a JSON array of strings when its name
 * ends in {@code .json}. Everything else comes from {@code dawg.properties}, system properties or environment
 * variables, see {@link DawgConfig}.
 */
public class DawgApp {
    private static final Logger log = LoggerFactory.getLogger(DawgApp.class);

    private static final Codec<GraphReport, String> REPORT_CODEC = new JacksonTypedJsonCodec<>(GraphReport.class).pretty();
    private static final Codec<List<String>, String> WORDS_CODEC = Codec.lines(Codec.identity());

    public static void main(String[] args) {
        DawgConfig config = DawgConfig.fromSystem();
        if (args.length > 0) config = config.withLexicon(args[0]);

        int status = run(config, System.out).fold(report -> 0, errors -> {
            errors.forEach(e -> log.error("{}", e));
            return 1;
        });
        if (status != 0) System.exit(status);
    }

    public static ErrorsOr<GraphReport> run(DawgConfig config, PrintStream out) {
        return LexiconLoader.load(config.lexicon()).flatMap(words -> build(config, words, out));
    }

    static ErrorsOr<GraphReport> build(DawgConfig config, List<String> words, PrintStream out) {
        return build(config, words, out, new InMemoryMetrics());
    }

    static ErrorsOr<GraphReport> build(DawgConfig config, List<String> words, PrintStream out, InMemoryMetrics metrics) {
        WordGraph graph = new WordGraph();
        int distinct = graph.insertAll(words);
        GraphStats before = graph.stats();
        log.info("Loaded {} words ({} distinct) from {}: {} nodes, {} transitions",
                words.size(), distinct, config.lexicon(), before.nodes(), before.transitions());

        ProgressListener listener = config.verbose()
                ? new LoggingProgressListener(config.progressStep())
                : ProgressListener.none();
        new Minimizer(metrics, listener).minimize(graph);
        List<Long> timings = metrics.histograms.get(Minimizer.MINIMIZE_MILLIS);
        long millis = timings.get(timings.size() - 1);

        GraphStats after = graph.stats();
        log.info("Minimized {} in {} ms: {} -> {} nodes", config.lexicon(), millis, before.nodes(), after.nodes());

        GraphReport report = GraphReport.of(config.lexicon(), before, after, metrics.counter(Minimizer.FUSED_GROUPS), millis);
        ErrorsOr<String> listing = config.words() ? WORDS_CODEC.encode(recognized(graph)) : ErrorsOr.lift("");
        return REPORT_CODEC.encode(report).flatMap(json -> listing.map(text -> {
            out.println(json);
            if (config.dump()) out.print(graph.dump());
            if (config.words()) out.println(text);
            return report;
        }));
    }

    private static List<String> recognized(WordGraph graph) {
        List<String> words = new ArrayList<>();
        graph.words().forEach(words::add);
        return words;
    }
}
