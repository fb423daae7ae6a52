package com.notionexport.core.model.block;

/**
 * Marker style of a list item.
 */
public enum ListStyle {
    BULLETED,
    NUMBERED
}
