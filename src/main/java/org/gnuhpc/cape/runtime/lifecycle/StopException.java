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

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Every stop action that failed during one stop pass, in the order they ran.
 * Each failure is also attached as a suppressed exception.
 */
public class StopException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    private final List<HookFailedException> failures;

    public StopException(List<HookFailedException> failures) {
        super(describe(failures), failures.isEmpty() ? null : failures.get(0));
        this.failures = Collections.unmodifiableList(failures);
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i));
        }
    }

    public List<HookFailedException> getFailures() {
        return failures;
    }

    private static String describe(List<HookFailedException> failures) {
        return failures.size() + " stop hook(s) failed: " + failures.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; "));
    }
}
