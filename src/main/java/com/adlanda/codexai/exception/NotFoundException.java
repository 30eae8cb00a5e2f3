package com.adlanda.codexai.exception;

/**
 * A project, chapter or file does not exist.
 */
public class NotFoundException extends CodexException {

    private final ResourceKind kind;
    private final String resourceId;

    public NotFoundException(ResourceKind kind, String resourceId) {
        super(describe(kind) + " '" + resourceId + "' not found");
        this.kind = kind;
        this.resourceId = resourceId;
    }

    public static NotFoundException project(String projectId) {
        return new NotFoundException(ResourceKind.PROJECT, projectId);
    }

    public static NotFoundException chapter(String chapterId) {
        return new NotFoundException(ResourceKind.CHAPTER, chapterId);
    }

    public ResourceKind getKind() {
        return kind;
    }

    public String getResourceId() {
        return resourceId;
    }

    private static String describe(ResourceKind kind) {
        return switch (kind) {
            case PROJECT -> "Project";
            case CHAPTER -> "Chapter";
            case FILE -> "File";
        };
    }
}
