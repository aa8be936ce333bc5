/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gnuhpc.cape.runtime.lifecycle;

import java.util.Arrays;
import java.util.List;

/**
 * Resolves the call site that registered a hook, provider or invocation, skipping the
 * runtime's own plumbing frames.
 */
public final class Callers {

    private static final List<String> INTERNAL_CLASSES = Arrays.asList(
            Callers.class.getName(),
            Hook.class.getName(),
            LifecycleManager.class.getName(),
            "org.gnuhpc.cape.runtime.launcher.App",
            "org.gnuhpc.cape.runtime.container.DefaultContainer");

    private static final StackWalker WALKER = StackWalker.getInstance();

    private Callers() {
    }

    /**
     * @return {@code class.method(File.java:line)} of the first non-internal frame
     */
    public static String caller() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !isInternal(frame.getClassName()))
                .findFirst()
                .map(frame -> frame.getClassName() + "." + frame.getMethodName()
                        + "(" + frame.getFileName() + ":" + frame.getLineNumber() + ")")
                .orElse("unknown"));
    }

    static boolean isInternal(String className) {
        for (String internal : INTERNAL_CLASSES) {
            if (className.equals(internal) || className.startsWith(internal + "$")) {
                return true;
            }
        }
        return false;
    }
}
