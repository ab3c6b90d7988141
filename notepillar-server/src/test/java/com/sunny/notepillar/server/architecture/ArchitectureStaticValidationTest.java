package com.sunny.notepillar.server.architecture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ArchitectureStaticValidationTest {

    private static final Pattern RAW_ILLEGAL_ARGUMENT = Pattern.compile("throw\\s+new\\s+IllegalArgumentException\\(");

    private static final Pattern RAW_RUNTIME_EXCEPTION = Pattern.compile("throw\\s+new\\s+(RuntimeException|IllegalStateException)\\(");

    private static final Pattern HTTP_SESSION_USAGE = Pattern.compile("HttpSession|request\\.getSession\\(");

    @Test
    void shouldNotThrowRawIllegalArgumentException() throws IOException {
        List<String> violations = findViolations(RAW_ILLEGAL_ARGUMENT);
        Assertions.assertTrue(violations.isEmpty(), "发现裸 IllegalArgumentException:\n" + String.join("\n", violations));
    }

    @Test
    void shouldNotThrowUntypedRuntimeException() throws IOException {
        List<String> violations = findViolations(RAW_RUNTIME_EXCEPTION);
        Assertions.assertTrue(violations.isEmpty(), "发现未分类的运行时异常:\n" + String.join("\n", violations));
    }

    @Test
    void shouldKeepSessionStateOutOfServletSession() throws IOException {
        List<String> violations = findViolations(HTTP_SESSION_USAGE);
        Assertions.assertTrue(violations.isEmpty(), "发现 Servlet 会话状态残留:\n" + String.join("\n", violations));
    }

    private List<Path> sourceRoots() {
        Path moduleRoot = Path.of(System.getProperty("user.dir"));
        return List.of(
                moduleRoot.resolve("src/main/java"),
                moduleRoot.resolveSibling("notepillar-common").resolve("src/main/java")
        );
    }

    private List<String> findViolations(Pattern pattern) throws IOException {
        List<String> violations = new ArrayList<>();
        for (Path root : sourceRoots()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (var paths = Files.walk(root)) {
                paths.filter(path -> Files.isRegularFile(path) && path.toString().endsWith(".java"))
                        .forEach(path -> checkFile(pattern, root, path, violations));
            }
        }
        return violations;
    }

    private void checkFile(Pattern pattern, Path root, Path file, List<String> violations) {
        try {
            List<String> lines = Files.readAllLines(file);
            for (int i = 0; i < lines.size(); i++) {
                if (pattern.matcher(lines.get(i)).find()) {
                    violations.add(root.relativize(file) + ":" + (i + 1) + " => " + lines.get(i).trim());
                }
            }
        } catch (IOException e) {
            violations.add(file + ":读取失败 " + e.getMessage());
        }
    }
}
