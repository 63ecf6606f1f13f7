package org.crosspress.exception;

public enum WarningType {
    CONTAINER,
    SPINE,
    MEDIA,
    STYLESHEET,
    NAVIGATION
}
