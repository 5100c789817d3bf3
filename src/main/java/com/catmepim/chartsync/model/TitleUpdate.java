package com.catmepim.chartsync.model;

/**
 * Outcome of a requested title or axis-title replacement.
 */
public enum TitleUpdate {
    /** No new text was supplied. */
    NOT_REQUESTED,
    /** The text node inside the title element was replaced. */
    UPDATED,
    /** The title element, or the text node within it, does not exist; nothing changed. */
    ANCHOR_NOT_FOUND
}
