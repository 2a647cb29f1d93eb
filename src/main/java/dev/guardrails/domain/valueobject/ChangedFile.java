package dev.guardrails.domain.valueobject;

import dev.guardrails.domain.enums.FileStatus;

/**
 * Immutable representation of a file touched by a pull request or commit.
 * {@code content} is the full file at the head revision when it could be fetched;
 * otherwise the scan falls back to {@code patch}.
 */
public record ChangedFile(
        String path,
        FileStatus status,
        String content,
        String patch,
        int additions,
        int deletions,
        int changes,
        String language
) {
    public ChangedFile {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path required");
        if (status == null) status = FileStatus.MODIFIED;
        if (language == null) language = detectLanguage(path);
    }

    public static String detectLanguage(String path) {
        if (path == null) return "unknown";
        String lower = path.toLowerCase();
        if (lower.endsWith(".java")) return "java";
        if (lower.endsWith(".kt")) return "kotlin";
        if (lower.endsWith(".py")) return "python";
        if (lower.endsWith(".js") || lower.endsWith(".jsx")) return "javascript";
        if (lower.endsWith(".ts") || lower.endsWith(".tsx")) return "typescript";
        if (lower.endsWith(".go")) return "go";
        if (lower.endsWith(".rb")) return "ruby";
        if (lower.endsWith(".cs")) return "csharp";
        if (lower.endsWith(".xml")) return "xml";
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) return "yaml";
        if (lower.endsWith(".json")) return "json";
        if (lower.endsWith(".properties")) return "properties";
        if (lower.endsWith(".sql")) return "sql";
        return "unknown";
    }

    public boolean isRemoved() {
        return status == FileStatus.REMOVED;
    }

    public boolean hasFullContent() {
        return content != null;
    }

    /** Lines in the fetched content, or 0 when only the patch is known. */
    public int lineCount() {
        return hasFullContent() ? (int) content.lines().count() : 0;
    }

    /**
     * Text sent to the analysis backend: full content, else the patch, else nothing.
     * Removed files never carry content.
     */
    public String scanContent() {
        if (isRemoved()) return "";
        if (content != null) return content;
        return patch != null ? patch : "";
    }

    public ChangedFile withContent(String fetched) {
        return new ChangedFile(path, status, fetched, patch, additions, deletions, changes, language);
    }
}
