package io.vecbench.core.config;

import io.vecbench.core.config.model.BackendsConfig;
import java.nio.file.Path;

/**
 * Outcome of {@code init}. {@code backends} already has environment credentials applied, and
 * {@code checkpointPresent} tells whether an interrupted recall sweep is waiting to resume.
 */
public record InitResult(
    Path configPath,
    Path dataDir,
    boolean createdConfig,
    boolean overwrittenConfig,
    BackendsConfig backends,
    boolean checkpointPresent
) {

    public Path checkpointPath() {
        return ConfigPaths.checkpointPath(dataDir);
    }
}
