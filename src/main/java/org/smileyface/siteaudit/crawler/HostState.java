package org.smileyface.siteaudit.crawler;

import crawlercommons.robots.BaseRobotRules;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Politeness bookkeeping of one origin. All mutable fields are guarded by {@link #lock};
 * {@link #changed} is signalled whenever the robots state, the in-flight count or the last start moves.
 */
final class HostState {

    final String origin;
    final ReentrantLock lock = new ReentrantLock();
    final Condition changed = lock.newCondition();

    RobotsState robotsState = RobotsState.UNKNOWN;
    BaseRobotRules rules;
    Duration delay;
    int inFlight;
    boolean started;
    long lastStartNanos;
    long fetchesStarted;

    HostState(String origin) {
        this.origin = origin;
    }
}
