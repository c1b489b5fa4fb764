package com.storylens.models;

/**
 * A story reference mark as it sits in a document.
 */
public class StoryMark {
    private int start;
    private int end;
    private String entityId;

    public StoryMark() {
    }

    public StoryMark(int start, int end, String entityId) {
        this.start = start;
        this.end = end;
        this.entityId = entityId;
    }

    public int getStart() { return start; }
    public void setStart(int start) { this.start = start; }

    public int getEnd() { return end; }
    public void setEnd(int end) { this.end = end; }

    public String getEntityId() { return entityId; }
    public void setEntityId(String entityId) { this.entityId = entityId; }
}
