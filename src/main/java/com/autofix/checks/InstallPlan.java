package com.autofix.checks;

import java.util.List;
import java.util.Optional;

/**
 * What dependency installation a workspace needs.
 *
 * @param packageManager manager used for installs and scripts, empty when there is no manifest
 * @param command        install argv, empty when installation is skipped
 */
public record InstallPlan(Optional<PackageManager> packageManager, List<String> command) {

    public static final InstallPlan SKIP = new InstallPlan(Optional.empty(), List.of());

    public boolean skipped() {
        return command.isEmpty();
    }
}
