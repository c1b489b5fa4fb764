package com.storylens.highlight;

/**
 * Read side of the editor document the highlighter is attached to.
 */
public interface DocumentModel {

    String getText();

    int getCursorOffset();

    /**
     * Best-effort word count; the window policy recounts from the text when deciding.
     */
    int getWordCount();

    void addChangeListener(DocumentChangeListener listener);

    void removeChangeListener(DocumentChangeListener listener);
}
