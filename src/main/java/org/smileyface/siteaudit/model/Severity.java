package org.smileyface.siteaudit.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
