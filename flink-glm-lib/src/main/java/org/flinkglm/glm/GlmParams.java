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

package org.flinkglm.glm;

import org.flinkglm.common.param.HasDimension;
import org.flinkglm.common.param.HasElasticNet;
import org.flinkglm.common.param.HasLearningRate;
import org.flinkglm.common.param.HasMaxConditionNumber;
import org.flinkglm.common.param.HasMaxIter;
import org.flinkglm.common.param.HasObjective;
import org.flinkglm.common.param.HasOptimizerMethod;
import org.flinkglm.common.param.HasReg;
import org.flinkglm.common.param.HasSeed;
import org.flinkglm.common.param.HasStepSizeCandidates;
import org.flinkglm.common.param.HasTol;

/**
 * Params for {@link GlmTrainer}.
 *
 * @param <T> The class type of this instance.
 */
public interface GlmParams<T>
        extends HasDimension<T>,
                HasObjective<T>,
                HasOptimizerMethod<T>,
                HasLearningRate<T>,
                HasReg<T>,
                HasElasticNet<T>,
                HasTol<T>,
                HasMaxIter<T>,
                HasStepSizeCandidates<T>,
                HasSeed<T>,
                HasMaxConditionNumber<T> {}
