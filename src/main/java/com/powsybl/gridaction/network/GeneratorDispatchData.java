/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

import com.powsybl.gridaction.exceptions.GridSchemaException;
import com.powsybl.gridaction.exceptions.IncorrectNumberOfElementsException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Static dispatch data of the generators of a grid. Its presence in a {@link GridSchema} enables
 * redispatching.
 *
 * @author PowSyBl grid action team
 */
public final class GeneratorDispatchData {

    private final GeneratorType[] types;
    private final double[] pmin;
    private final double[] pmax;
    private final boolean[] redispatchable;
    private final double[] maxRampUp;
    private final double[] maxRampDown;
    private final int[] minUpTime;
    private final int[] minDownTime;
    private final double[] costPerMw;
    private final double[] startupCost;
    private final double[] shutdownCost;

    private GeneratorDispatchData(Builder builder) {
        int count = builder.pmax.length;
        types = builder.types != null ? builder.types.clone() : filled(count, GeneratorType.THERMAL);
        pmin = builder.pmin.clone();
        pmax = builder.pmax.clone();
        redispatchable = builder.redispatchable.clone();
        maxRampUp = builder.maxRampUp.clone();
        maxRampDown = builder.maxRampDown.clone();
        minUpTime = builder.minUpTime != null ? builder.minUpTime.clone() : new int[count];
        minDownTime = builder.minDownTime != null ? builder.minDownTime.clone() : new int[count];
        costPerMw = builder.costPerMw != null ? builder.costPerMw.clone() : new double[count];
        startupCost = builder.startupCost != null ? builder.startupCost.clone() : new double[count];
        shutdownCost = builder.shutdownCost != null ? builder.shutdownCost.clone() : new double[count];
    }

    private static GeneratorType[] filled(int count, GeneratorType type) {
        GeneratorType[] result = new GeneratorType[count];
        Arrays.fill(result, type);
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getGeneratorCount() {
        return pmax.length;
    }

    public GeneratorType getType(int gen) {
        return types[gen];
    }

    public double getPmin(int gen) {
        return pmin[gen];
    }

    public double getPmax(int gen) {
        return pmax[gen];
    }

    public boolean isRedispatchable(int gen) {
        return redispatchable[gen];
    }

    public double getMaxRampUp(int gen) {
        return maxRampUp[gen];
    }

    public double getMaxRampDown(int gen) {
        return maxRampDown[gen];
    }

    public int getMinUpTime(int gen) {
        return minUpTime[gen];
    }

    public int getMinDownTime(int gen) {
        return minDownTime[gen];
    }

    public double getCostPerMw(int gen) {
        return costPerMw[gen];
    }

    public double getStartupCost(int gen) {
        return startupCost[gen];
    }

    public double getShutdownCost(int gen) {
        return shutdownCost[gen];
    }

    public GeneratorType[] getTypes() {
        return types.clone();
    }

    public double[] getPmin() {
        return pmin.clone();
    }

    public double[] getPmax() {
        return pmax.clone();
    }

    public boolean[] getRedispatchable() {
        return redispatchable.clone();
    }

    public double[] getMaxRampUp() {
        return maxRampUp.clone();
    }

    public double[] getMaxRampDown() {
        return maxRampDown.clone();
    }

    public int[] getMinUpTime() {
        return minUpTime.clone();
    }

    public int[] getMinDownTime() {
        return minDownTime.clone();
    }

    public double[] getCostPerMw() {
        return costPerMw.clone();
    }

    public double[] getStartupCost() {
        return startupCost.clone();
    }

    public double[] getShutdownCost() {
        return shutdownCost.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeneratorDispatchData other)) {
            return false;
        }
        return Arrays.equals(types, other.types)
                && Arrays.equals(pmin, other.pmin)
                && Arrays.equals(pmax, other.pmax)
                && Arrays.equals(redispatchable, other.redispatchable)
                && Arrays.equals(maxRampUp, other.maxRampUp)
                && Arrays.equals(maxRampDown, other.maxRampDown)
                && Arrays.equals(minUpTime, other.minUpTime)
                && Arrays.equals(minDownTime, other.minDownTime)
                && Arrays.equals(costPerMw, other.costPerMw)
                && Arrays.equals(startupCost, other.startupCost)
                && Arrays.equals(shutdownCost, other.shutdownCost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(pmin), Arrays.hashCode(pmax), Arrays.hashCode(redispatchable));
    }

    public static final class Builder {

        private GeneratorType[] types;
        private double[] pmin;
        private double[] pmax;
        private boolean[] redispatchable;
        private double[] maxRampUp;
        private double[] maxRampDown;
        private int[] minUpTime;
        private int[] minDownTime;
        private double[] costPerMw;
        private double[] startupCost;
        private double[] shutdownCost;

        private Builder() {
        }

        public Builder setTypes(GeneratorType... types) {
            this.types = Objects.requireNonNull(types);
            return this;
        }

        public Builder setPmin(double... pmin) {
            this.pmin = Objects.requireNonNull(pmin);
            return this;
        }

        public Builder setPmax(double... pmax) {
            this.pmax = Objects.requireNonNull(pmax);
            return this;
        }

        public Builder setRedispatchable(boolean... redispatchable) {
            this.redispatchable = Objects.requireNonNull(redispatchable);
            return this;
        }

        public Builder setMaxRampUp(double... maxRampUp) {
            this.maxRampUp = Objects.requireNonNull(maxRampUp);
            return this;
        }

        public Builder setMaxRampDown(double... maxRampDown) {
            this.maxRampDown = Objects.requireNonNull(maxRampDown);
            return this;
        }

        public Builder setMinUpTime(int... minUpTime) {
            this.minUpTime = Objects.requireNonNull(minUpTime);
            return this;
        }

        public Builder setMinDownTime(int... minDownTime) {
            this.minDownTime = Objects.requireNonNull(minDownTime);
            return this;
        }

        public Builder setCostPerMw(double... costPerMw) {
            this.costPerMw = Objects.requireNonNull(costPerMw);
            return this;
        }

        public Builder setStartupCost(double... startupCost) {
            this.startupCost = Objects.requireNonNull(startupCost);
            return this;
        }

        public Builder setShutdownCost(double... shutdownCost) {
            this.shutdownCost = Objects.requireNonNull(shutdownCost);
            return this;
        }

        public GeneratorDispatchData build() {
            if (pmin == null || pmax == null || redispatchable == null || maxRampUp == null || maxRampDown == null) {
                throw new GridSchemaException("Generator dispatch data needs at least pmin, pmax, redispatchable, max ramp up and max ramp down");
            }
            int count = pmax.length;
            checkLength("pmin", pmin.length, count);
            checkLength("redispatchable", redispatchable.length, count);
            checkLength("max ramp up", maxRampUp.length, count);
            checkLength("max ramp down", maxRampDown.length, count);
            if (types != null) {
                checkLength("type", types.length, count);
            }
            if (minUpTime != null) {
                checkLength("min up time", minUpTime.length, count);
            }
            if (minDownTime != null) {
                checkLength("min down time", minDownTime.length, count);
            }
            if (costPerMw != null) {
                checkLength("cost per MW", costPerMw.length, count);
            }
            if (startupCost != null) {
                checkLength("startup cost", startupCost.length, count);
            }
            if (shutdownCost != null) {
                checkLength("shutdown cost", shutdownCost.length, count);
            }
            GeneratorDispatchData data = new GeneratorDispatchData(this);
            data.validate();
            return data;
        }

        private static void checkLength(String attribute, int length, int count) {
            if (length != count) {
                throw new IncorrectNumberOfElementsException("Generator " + attribute + " has " + length
                        + " values while pmax has " + count);
            }
        }
    }

    private void validate() {
        for (int gen = 0; gen < pmax.length; gen++) {
            checkNonNegative("pmin", gen, pmin[gen]);
            checkNonNegative("pmax", gen, pmax[gen]);
            checkNonNegative("max ramp up", gen, maxRampUp[gen]);
            checkNonNegative("max ramp down", gen, maxRampDown[gen]);
            checkNonNegative("cost per MW", gen, costPerMw[gen]);
            checkNonNegative("startup cost", gen, startupCost[gen]);
            checkNonNegative("shutdown cost", gen, shutdownCost[gen]);
            if (minUpTime[gen] < 0 || minDownTime[gen] < 0) {
                throw new GridSchemaException("Generator " + gen + " has a negative minimum up or down time");
            }
            if (types[gen] == null) {
                throw new GridSchemaException("Generator " + gen + " has no type");
            }
            if (pmin[gen] > pmax[gen]) {
                throw new GridSchemaException("Generator " + gen + " has pmin " + pmin[gen] + " above its pmax " + pmax[gen]);
            }
            if (redispatchable[gen] && (maxRampUp[gen] > pmax[gen] || maxRampDown[gen] > pmax[gen])) {
                throw new GridSchemaException("Redispatchable generator " + gen + " has a ramp above its pmax " + pmax[gen]);
            }
        }
    }

    private static void checkNonNegative(String attribute, int gen, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new GridSchemaException("Generator " + gen + " has an invalid " + attribute + ": " + value);
        }
    }
}
