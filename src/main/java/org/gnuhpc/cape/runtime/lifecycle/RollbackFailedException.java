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

/**
 * Start failed and the automatic rollback failed too. The start failure is the cause; the
 * rollback failure is suppressed and also available from {@link #getRollbackFailure()}.
 */
public class RollbackFailedException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    private final LifecycleException startFailure;
    private final LifecycleException rollbackFailure;

    public RollbackFailedException(LifecycleException startFailure, LifecycleException rollbackFailure) {
        super("start failed: " + startFailure.getMessage()
                + "; rollback failed: " + rollbackFailure.getMessage(), startFailure);
        this.startFailure = startFailure;
        this.rollbackFailure = rollbackFailure;
        addSuppressed(rollbackFailure);
    }

    public LifecycleException getStartFailure() {
        return startFailure;
    }

    public LifecycleException getRollbackFailure() {
        return rollbackFailure;
    }
}
