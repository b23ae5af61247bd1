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

package org.flinkglm.common.feature;

import org.flinkglm.linalg.DenseVector;

import java.util.Objects;

/**
 * A training example: features, label and weight. The weight multiplies every loss, gradient and
 * Hessian contribution of the example.
 *
 * <p>For survival data the label is the observed time and {@code event} tells whether the death was
 * observed (true) or the example is censored (false). Other objectives ignore {@code event}.
 */
public class LabeledPoint {

    private DenseVector features;

    private double label;

    private double weight;

    private boolean event;

    public LabeledPoint(DenseVector features, double label, double weight, boolean event) {
        this.features = features;
        this.label = label;
        this.weight = weight;
        this.event = event;
    }

    public LabeledPoint(DenseVector features, double label, double weight) {
        this(features, label, weight, true);
    }

    public LabeledPoint(DenseVector features, double label) {
        this(features, label, 1.0, true);
    }

    /** Creates an example of weight 1 with an observed event, for Flink POJO serialization. */
    public LabeledPoint() {
        this.weight = 1.0;
        this.event = true;
    }

    public DenseVector getFeatures() {
        return features;
    }

    public void setFeatures(DenseVector features) {
        this.features = features;
    }

    public double getLabel() {
        return label;
    }

    public void setLabel(double label) {
        this.label = label;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public boolean isEvent() {
        return event;
    }

    public void setEvent(boolean event) {
        this.event = event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabeledPoint)) {
            return false;
        }
        LabeledPoint that = (LabeledPoint) o;
        return Double.compare(that.label, label) == 0
                && Double.compare(that.weight, weight) == 0
                && event == that.event
                && Objects.equals(features, that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(features, label, weight, event);
    }

    @Override
    public String toString() {
        return "LabeledPoint{features="
                + features
                + ", label="
                + label
                + ", weight="
                + weight
                + ", event="
                + event
                + '}';
    }
}
