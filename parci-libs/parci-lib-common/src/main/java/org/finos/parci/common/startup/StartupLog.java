/*
 * Licensed to the Fintech Open Source Foundation (FINOS) under one or
 * more contributor license agreements. See the NOTICE file distributed
 * with this work for additional information regarding copyright ownership.
 * FINOS licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with the
 * License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.finos.parci.common.startup;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;


/**
 * Log messages before the logging system is configured.
 *
 * <p>Until {@link #setLogSystemActive()} is called, INFO and above are written to stderr
 * (stdout is reserved for command output). Lower levels are held back and replayed into SLF4J
 * once logging is active, so config loading can be traced with a debug log config.</p>
 */
public class StartupLog {

    private static final List<DeferredMessage> deferred = new ArrayList<>();

    private static boolean logSystemActive = false;

    public static synchronized void setLogSystemActive() {

        logSystemActive = true;

        for (var message : deferred)
            LoggerFactory.getLogger(message.source).atLevel(message.level).log(message.text);

        deferred.clear();
    }

    public static synchronized void log(Object obj, Level level, String message) {

        if (logSystemActive)
            LoggerFactory.getLogger(obj.getClass()).atLevel(level).log(message);

        else if (level.toInt() >= Level.INFO.toInt())
            System.err.println(message);

        else
            deferred.add(new DeferredMessage(obj.getClass(), level, message));
    }

    @VisibleForTesting
    static synchronized int deferredCount() {
        return deferred.size();
    }

    @VisibleForTesting
    static synchronized void reset() {
        logSystemActive = false;
        deferred.clear();
    }

    private static class DeferredMessage {

        final Class<?> source;
        final Level level;
        final String text;

        DeferredMessage(Class<?> source, Level level, String text) {
            this.source = source;
            this.level = level;
            this.text = text;
        }
    }
}
