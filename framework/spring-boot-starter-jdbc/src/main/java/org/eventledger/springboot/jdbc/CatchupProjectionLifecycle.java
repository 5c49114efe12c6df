/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventledger.springboot.jdbc;

import org.eventledger.subscription.blocking.catchup.CatchupProjectionRunner;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link CatchupProjectionRunner} once the application context is refreshed, which is after the schema
 * has been initialized, and shuts it down when the context is closed.
 */
class CatchupProjectionLifecycle implements SmartLifecycle {

    private final CatchupProjectionRunner runner;

    CatchupProjectionLifecycle(CatchupProjectionRunner runner) {
        this.runner = runner;
    }

    @Override
    public void start() {
        runner.start();
    }

    @Override
    public void stop() {
        runner.shutdown();
    }

    @Override
    public boolean isRunning() {
        return runner.isRunning();
    }
}
