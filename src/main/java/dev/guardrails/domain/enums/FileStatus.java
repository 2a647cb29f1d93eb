package dev.guardrails.domain.enums;

/**
 * Change status of a file, as reported by the pull request and commit APIs.
 * GitHub's "copied", "changed" and "unchanged" collapse to MODIFIED.
 */
public enum FileStatus {
    ADDED, MODIFIED, REMOVED, RENAMED;

    public static FileStatus fromApi(String value) {
        if (value == null) return MODIFIED;
        return switch (value) {
            case "added" -> ADDED;
            case "removed" -> REMOVED;
            case "renamed" -> RENAMED;
            default -> MODIFIED;
        };
    }

    public String wireValue() {
        return name().toLowerCase();
    }
}
