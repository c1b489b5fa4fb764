package com.storylens.highlight;

public interface DocumentChangeListener {

    void onTextChanged();

    void onSelectionChanged();
}
