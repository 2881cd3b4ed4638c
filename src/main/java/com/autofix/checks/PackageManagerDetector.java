package com.autofix.checks;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Chooses the install command from the lock files present: pnpm, then yarn, then npm.
 * A manifest without a lock file gets a plain {@code npm install}; no manifest skips installation.
 */
public final class PackageManagerDetector {

    static final String MANIFEST = "package.json";

    private PackageManagerDetector() {}

    public static InstallPlan detect(Path dir) {
        for (PackageManager pm : PackageManager.values()) {
            if (Files.exists(dir.resolve(pm.lockFile()))) {
                return new InstallPlan(Optional.of(pm), pm.installCommand());
            }
        }
        if (Files.exists(dir.resolve(MANIFEST))) {
            return new InstallPlan(Optional.of(PackageManager.NPM), List.of("npm", "install"));
        }
        return InstallPlan.SKIP;
    }
}
