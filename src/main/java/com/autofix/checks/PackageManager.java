package com.autofix.checks;

import java.util.List;

/**
 * Supported JavaScript package managers, in detection priority order.
 */
public enum PackageManager {
    PNPM("pnpm-lock.yaml", List.of("pnpm", "install", "--frozen-lockfile")),
    YARN("yarn.lock", List.of("yarn", "install", "--frozen-lockfile")),
    NPM("package-lock.json", List.of("npm", "ci"));

    private final String lockFile;
    private final List<String> installCommand;

    PackageManager(String lockFile, List<String> installCommand) {
        this.lockFile = lockFile;
        this.installCommand = installCommand;
    }

    public String lockFile() {
        return lockFile;
    }

    public List<String> installCommand() {
        return installCommand;
    }

    public String executable() {
        return name().toLowerCase();
    }

    public List<String> runScript(String script) {
        return List.of(executable(), "run", script);
    }
}
