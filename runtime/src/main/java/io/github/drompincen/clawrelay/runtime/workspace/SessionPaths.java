package io.github.drompincen.clawrelay.runtime.workspace;

import java.nio.file.Path;

/** Directory tree owned by a single session: {@code <base>/<sessionId>/{workspace,data,logs}}. */
public record SessionPaths(
        Path root,
        Path workspace,
        Path data,
        Path logs
) {
    public static SessionPaths under(Path base, String sessionId) {
        Path root = base.resolve(sessionId);
        return new SessionPaths(root, root.resolve("workspace"), root.resolve("data"), root.resolve("logs"));
    }

    /** Rebuilds the tree from a persisted workspace path, whose parent is the session root. */
    public static SessionPaths fromWorkspace(Path workspace, Path data, Path logs) {
        return new SessionPaths(workspace.getParent(), workspace, data, logs);
    }
}
