/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;


/**
 * {@link LeakTracker} that writes leaked objects to the log
 */
public class LoggingLeakTracker implements LeakTracker {
    private static final Logger log = LoggerFactory.getLogger(LoggingLeakTracker.class);

    private int reportedLeaks;

    @Override
    public void leakedObjects(List<Object> leaked) {
        reportedLeaks += leaked.size();
        log.warn("{} live objects outlived their last scope", leaked.size());
        for (Object object : leaked) {
            log.warn("leaked {}@{}", object.getClass().getName(), Integer.toHexString(System.identityHashCode(object)));
        }
    }

    /**
     * @return number of leaked objects reported since this tracker was created
     */
    public int getReportedLeaks() {
        return reportedLeaks;
    }
}
