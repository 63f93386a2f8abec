package io.leavesfly.meer.tool.file;

import java.nio.file.Path;

/**
 * 工作目录内的路径解析
 * 相对路径基于工作目录解析；解析后不在工作目录内的路径一律拒绝
 */
public final class WorkDirPaths {

    private WorkDirPaths() {
    }

    /**
     * @throws IllegalArgumentException 路径为空或越出工作目录
     */
    public static Path resolve(Path workDir, String path) {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException("Path is required.");
        }
        Path root = workDir.toAbsolutePath().normalize();
        Path resolved = root.resolve(path.trim()).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException(String.format(
                    "`%s` is outside the working directory. You can only access files within %s.", path, root));
        }
        return resolved;
    }

    /**
     * 相对工作目录的显示路径
     */
    public static String display(Path workDir, Path path) {
        Path root = workDir.toAbsolutePath().normalize();
        String relative = root.relativize(path.toAbsolutePath().normalize()).toString();
        return relative.isEmpty() ? "." : relative;
    }
}
