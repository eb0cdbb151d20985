package io.vecbench.core.checkpoint;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vecbench.core.model.RecallRun;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Progress of a recall sweep: every run recorded so far and the keys of the configurations
 * whose runs are all present. Runs of an unfinished configuration are never part of it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(
    @JsonProperty("raw_runs") List<RecallRun> rawRuns,
    @JsonProperty("completed_configs") @JsonAlias({"completedConfigs"}) Set<String> completedConfigs
) {
    public Checkpoint {
        rawRuns = rawRuns == null ? List.of() : List.copyOf(rawRuns);
        completedConfigs = completedConfigs == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(completedConfigs));
    }

    /**
     * Fewest stored runs a completed configuration needs to be summarized.
     */
    public static final int MIN_RUNS_PER_CONFIG = 2;

    public static Checkpoint empty() {
        return new Checkpoint(List.of(), Set.of());
    }

    public boolean isCompleted(String configKey) {
        return completedConfigs.contains(configKey);
    }

    public Checkpoint withCompleted(String configKey, List<RecallRun> runs) {
        List<RecallRun> allRuns = new ArrayList<>(rawRuns);
        allRuns.addAll(runs);
        Set<String> keys = new LinkedHashSet<>(completedConfigs);
        keys.add(configKey);
        return new Checkpoint(allRuns, keys);
    }

    /**
     * Drops completed keys with fewer than {@link #MIN_RUNS_PER_CONFIG} stored runs, and runs
     * whose key is not completed. The dropped configurations are measured again.
     */
    public Checkpoint withoutIncompleteConfigs() {
        Map<String, Integer> runCounts = new HashMap<>();
        for (RecallRun run : rawRuns) {
            runCounts.merge(run.configKey(), 1, Integer::sum);
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String key : completedConfigs) {
            if (runCounts.getOrDefault(key, 0) >= MIN_RUNS_PER_CONFIG) {
                keys.add(key);
            }
        }
        List<RecallRun> runs = rawRuns.stream().filter(run -> keys.contains(run.configKey())).toList();
        return new Checkpoint(runs, keys);
    }
}
