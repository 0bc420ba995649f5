package org.smileyface.siteaudit.processor;

/**
 * Lifecycle state of a FetchWorker.
 */
public enum WorkerState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}
