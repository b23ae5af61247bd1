/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.flinkglm.iteration.store;

import org.flinkglm.common.feature.LabeledPoint;
import org.flinkglm.common.lossfunc.ObjectiveKind;
import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.NewtonRaphson;
import org.flinkglm.common.optimizer.TaskConfig;
import org.flinkglm.util.TestUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

/** Tests {@link FileStateStore} and {@link InMemoryStateStore}. */
public class StateStoreTest {
    @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

    private AccumulatorState first;

    private AccumulatorState second;

    @Before
    public void before() {
        TaskConfig config = new TaskConfig(3, 0.1, 0.1, 0, ObjectiveKind.LOGISTIC);
        List<LabeledPoint> points = TestUtils.classificationData(16);
        first = TestUtils.foldAndFinalize(new NewtonRaphson(config, null), points);
        second = TestUtils.foldAndFinalize(new NewtonRaphson(config, first), points);
    }

    private void verifyStore(StateStore store) throws IOException {
        assertEquals(0, store.latestIteration());
        assertFalse(store.latest().isPresent());
        assertFalse(store.get(1).isPresent());

        store.put(1, first);
        store.put(2, second);
        assertEquals(2, store.latestIteration());
        assertEquals(first, store.get(1).get());
        assertEquals(second, store.latest().get());

        // Rewriting an iteration replaces the stored state.
        store.put(2, first);
        assertEquals(first, store.get(2).get());
        assertEquals(2, store.latestIteration());
    }

    @Test
    public void testInMemoryStore() throws IOException {
        InMemoryStateStore store = new InMemoryStateStore();
        verifyStore(store);

        // The store keeps copies.
        AccumulatorState stored = store.get(1).get();
        assertEquals(first, stored);
        assertNotSame(stored, store.get(1).get());
    }

    @Test
    public void testFileStore() throws IOException {
        String path = tempFolder.newFolder().getAbsolutePath() + "/states";
        verifyStore(new FileStateStore(path));

        File[] files = new File(path).listFiles();
        assertEquals(2, files.length);
        for (File file : files) {
            assertTrue(file.getName().matches("state-0000[12]\\.bin"));
        }

        // A second store over the same directory sees the states of the first.
        FileStateStore reopened = new FileStateStore(path);
        assertEquals(2, reopened.latestIteration());
        assertEquals(first, reopened.get(1).get());
    }
}
