package ai.codegauge.analyzer;

import java.util.List;
import org.treesitter.TSLanguage;

/** A source language the engine can measure: its grammar plus the node tables the walkers consult. */
public interface MetricsLanguage {

    List<String> getExtensions();

    String name(); // Human-friendly

    String internalName(); // Filesystem-safe

    /**
     * Creates a new TSLanguage instance. Called once per parser, and parsers are confined to a single thread.
     */
    TSLanguage createTSLanguage();

    MetricsSyntaxProfile getSyntaxProfile();
}
