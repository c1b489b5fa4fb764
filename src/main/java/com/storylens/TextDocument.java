package com.storylens;

import com.storylens.highlight.DocumentChangeListener;
import com.storylens.highlight.DocumentModel;
import com.storylens.highlight.MarkTarget;
import com.storylens.highlight.StaleApplyException;
import com.storylens.models.StoryMark;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server-side mirror of an editor document: text, cursor and story reference marks.
 *
 * Edits move marks the way a rich-text editor does: marks after the edit shift by the length
 * change, marks touching the edited range are dropped.
 */
public class TextDocument implements DocumentModel, MarkTarget {

    private final String id;
    private final List<DocumentChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final TreeMap<Integer, StoryMark> marks = new TreeMap<>();
    private String title;
    private String text;
    private int cursor;

    public TextDocument(String id, String title, String text) {
        this.id = id;
        this.title = title;
        this.text = text != null ? text : "";
        this.cursor = 0;
    }

    public String getId() {
        return id;
    }

    public synchronized String getTitle() {
        return title;
    }

    public synchronized void setTitle(String title) {
        this.title = title;
    }

    @Override
    public synchronized String getText() {
        return text;
    }

    @Override
    public synchronized int getCursorOffset() {
        return cursor;
    }

    @Override
    public synchronized int getWordCount() {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    @Override
    public void addChangeListener(DocumentChangeListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeChangeListener(DocumentChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Replaces the whole text. Only the span that actually differs counts as edited, so marks
     * before and after it survive.
     */
    public void setText(String newText) {
        String next = newText != null ? newText : "";
        synchronized (this) {
            if (next.equals(text)) {
                return;
            }
            int prefix = 0;
            int max = Math.min(text.length(), next.length());
            while (prefix < max && text.charAt(prefix) == next.charAt(prefix)) {
                prefix++;
            }
            int suffix = 0;
            while (suffix < max - prefix
                && text.charAt(text.length() - 1 - suffix) == next.charAt(next.length() - 1 - suffix)) {
                suffix++;
            }
            replaceLocked(prefix, text.length() - suffix, next.substring(prefix, next.length() - suffix));
        }
        fireTextChanged();
    }

    /**
     * Replaces {@code [start, end)} with {@code replacement} and puts the cursor after it.
     */
    public void edit(int start, int end, String replacement) {
        synchronized (this) {
            if (start < 0 || end < start || end > text.length()) {
                throw new IllegalArgumentException("Edit range [" + start + ", " + end + ") outside document of length "
                    + text.length());
            }
            replaceLocked(start, end, replacement != null ? replacement : "");
        }
        fireTextChanged();
    }

    public void setCursor(int offset) {
        synchronized (this) {
            int clamped = Math.max(0, Math.min(offset, text.length()));
            if (clamped == cursor) {
                return;
            }
            cursor = clamped;
        }
        for (DocumentChangeListener listener : listeners) {
            listener.onSelectionChanged();
        }
    }

    private void replaceLocked(int start, int end, String replacement) {
        text = text.substring(0, start) + replacement + text.substring(end);
        int delta = replacement.length() - (end - start);

        TreeMap<Integer, StoryMark> shifted = new TreeMap<>();
        for (StoryMark mark : marks.values()) {
            if (mark.getEnd() <= start) {
                shifted.put(mark.getStart(), mark);
            } else if (mark.getStart() >= end) {
                shifted.put(mark.getStart() + delta,
                    new StoryMark(mark.getStart() + delta, mark.getEnd() + delta, mark.getEntityId()));
            }
        }
        marks.clear();
        marks.putAll(shifted);
        cursor = start + replacement.length();
    }

    @Override
    public synchronized void applyMark(int start, int end, String entityId) {
        if (start < 0 || end <= start || end > text.length()) {
            throw new StaleApplyException("Mark [" + start + ", " + end + ") outside document of length "
                + text.length());
        }
        Integer from = marks.floorKey(start);
        Iterator<StoryMark> overlapping = marks.tailMap(from != null ? from : start, true).values().iterator();
        while (overlapping.hasNext()) {
            StoryMark mark = overlapping.next();
            if (mark.getStart() >= end) {
                break;
            }
            if (mark.getEnd() > start) {
                overlapping.remove();
            }
        }
        marks.put(start, new StoryMark(start, end, entityId));
    }

    @Override
    public synchronized void removeMark(int start, int end) {
        StoryMark existing = marks.get(start);
        if (existing != null && existing.getEnd() == end) {
            marks.remove(start);
        }
    }

    public synchronized List<StoryMark> getMarks() {
        List<StoryMark> copy = new ArrayList<>();
        for (StoryMark mark : marks.values()) {
            copy.add(new StoryMark(mark.getStart(), mark.getEnd(), mark.getEntityId()));
        }
        return copy;
    }

    private void fireTextChanged() {
        for (DocumentChangeListener listener : listeners) {
            listener.onTextChanged();
        }
    }
}
