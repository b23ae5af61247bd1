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

import org.apache.flink.core.fs.FSDataInputStream;
import org.apache.flink.core.fs.FSDataOutputStream;
import org.apache.flink.core.fs.FileStatus;
import org.apache.flink.core.fs.FileSystem;
import org.apache.flink.core.fs.Path;
import org.apache.flink.core.memory.DataInputViewStreamWrapper;
import org.apache.flink.core.memory.DataOutputViewStreamWrapper;
import org.apache.flink.util.Preconditions;

import org.flinkglm.common.optimizer.AccumulatorState;
import org.flinkglm.common.optimizer.typeinfo.AccumulatorStateSerializer;

import java.io.IOException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@link StateStore} writing one file per iteration under a directory of any Flink {@link
 * FileSystem}, in the layout of {@link AccumulatorStateSerializer}. A state is first written to a
 * temporary file, then renamed.
 */
public class FileStateStore implements StateStore {
    private static final Pattern FILE_NAME = Pattern.compile("state-(\\d+)\\.bin");

    private final Path dir;

    public FileStateStore(String dir) throws IOException {
        this(new Path(dir));
    }

    public FileStateStore(Path dir) throws IOException {
        this.dir = Preconditions.checkNotNull(dir);
        FileSystem fs = dir.getFileSystem();
        if (!fs.exists(dir) && !fs.mkdirs(dir)) {
            throw new IOException("Cannot create directory " + dir + ".");
        }
    }

    public Path getDir() {
        return dir;
    }

    @Override
    public void put(int iteration, AccumulatorState state) throws IOException {
        Preconditions.checkArgument(iteration > 0, "Iterations start at 1.");
        FileSystem fs = dir.getFileSystem();
        Path target = getPath(iteration);
        Path tmp = new Path(dir, "." + target.getName() + ".tmp");
        try (FSDataOutputStream out = fs.create(tmp, FileSystem.WriteMode.OVERWRITE)) {
            AccumulatorStateSerializer.INSTANCE.serialize(
                    state, new DataOutputViewStreamWrapper(out));
        }
        if (fs.exists(target)) {
            fs.delete(target, false);
        }
        if (!fs.rename(tmp, target)) {
            throw new IOException("Cannot rename " + tmp + " to " + target + ".");
        }
    }

    @Override
    public Optional<AccumulatorState> get(int iteration) throws IOException {
        Path path = getPath(iteration);
        FileSystem fs = dir.getFileSystem();
        if (!fs.exists(path)) {
            return Optional.empty();
        }
        try (FSDataInputStream in = fs.open(path)) {
            return Optional.of(
                    AccumulatorStateSerializer.INSTANCE.deserialize(
                            new DataInputViewStreamWrapper(in)));
        }
    }

    @Override
    public int latestIteration() throws IOException {
        FileStatus[] statuses = dir.getFileSystem().listStatus(dir);
        int latest = 0;
        if (statuses == null) {
            return latest;
        }
        for (FileStatus status : statuses) {
            Matcher matcher = FILE_NAME.matcher(status.getPath().getName());
            if (matcher.matches()) {
                latest = Math.max(latest, Integer.parseInt(matcher.group(1)));
            }
        }
        return latest;
    }

    private Path getPath(int iteration) {
        return new Path(dir, String.format("state-%05d.bin", iteration));
    }
}
