package com.adlanda.codexai.content;

/**
 * Published whenever a project document is created, updated or deleted.
 *
 * @param projectId    Project the document belongs to
 * @param relativePath Path relative to the project directory
 * @param changeType   What happened to the document
 */
public record ContentChangedEvent(String projectId, String relativePath, ChangeType changeType) {

    public enum ChangeType {
        CREATED,
        UPDATED,
        DELETED
    }

    public static ContentChangedEvent updated(String projectId, String relativePath) {
        return new ContentChangedEvent(projectId, relativePath, ChangeType.UPDATED);
    }

    public static ContentChangedEvent deleted(String projectId, String relativePath) {
        return new ContentChangedEvent(projectId, relativePath, ChangeType.DELETED);
    }
}
