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
 * Static data of the storage units of a grid. Powers follow the load sign convention: a positive
 * setpoint charges the unit.
 *
 * @author PowSyBl grid action team
 */
public final class StorageUnitData {

    public static final String DEFAULT_TYPE = "battery";

    private final String[] types;
    private final double[] emax;
    private final double[] emin;
    private final double[] maxPProd;
    private final double[] maxPAbsorb;
    private final double[] marginalCost;
    private final double[] loss;
    private final double[] chargingEfficiency;
    private final double[] dischargingEfficiency;

    private StorageUnitData(Builder builder) {
        int count = builder.emax.length;
        types = builder.types != null ? builder.types.clone() : filled(count, DEFAULT_TYPE);
        emax = builder.emax.clone();
        emin = builder.emin.clone();
        maxPProd = builder.maxPProd.clone();
        maxPAbsorb = builder.maxPAbsorb.clone();
        marginalCost = builder.marginalCost != null ? builder.marginalCost.clone() : new double[count];
        loss = builder.loss != null ? builder.loss.clone() : new double[count];
        chargingEfficiency = builder.chargingEfficiency != null ? builder.chargingEfficiency.clone() : ones(count);
        dischargingEfficiency = builder.dischargingEfficiency != null ? builder.dischargingEfficiency.clone() : ones(count);
    }

    private static String[] filled(int count, String value) {
        String[] result = new String[count];
        Arrays.fill(result, value);
        return result;
    }

    private static double[] ones(int count) {
        double[] result = new double[count];
        Arrays.fill(result, 1.0);
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getStorageCount() {
        return emax.length;
    }

    public String getType(int storage) {
        return types[storage];
    }

    public double getEmax(int storage) {
        return emax[storage];
    }

    public double getEmin(int storage) {
        return emin[storage];
    }

    public double getMaxPProd(int storage) {
        return maxPProd[storage];
    }

    public double getMaxPAbsorb(int storage) {
        return maxPAbsorb[storage];
    }

    public double getMarginalCost(int storage) {
        return marginalCost[storage];
    }

    public double getLoss(int storage) {
        return loss[storage];
    }

    public double getChargingEfficiency(int storage) {
        return chargingEfficiency[storage];
    }

    public double getDischargingEfficiency(int storage) {
        return dischargingEfficiency[storage];
    }

    public String[] getTypes() {
        return types.clone();
    }

    public double[] getEmax() {
        return emax.clone();
    }

    public double[] getEmin() {
        return emin.clone();
    }

    public double[] getMaxPProd() {
        return maxPProd.clone();
    }

    public double[] getMaxPAbsorb() {
        return maxPAbsorb.clone();
    }

    public double[] getMarginalCost() {
        return marginalCost.clone();
    }

    public double[] getLoss() {
        return loss.clone();
    }

    public double[] getChargingEfficiency() {
        return chargingEfficiency.clone();
    }

    public double[] getDischargingEfficiency() {
        return dischargingEfficiency.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StorageUnitData other)) {
            return false;
        }
        return Arrays.equals(types, other.types)
                && Arrays.equals(emax, other.emax)
                && Arrays.equals(emin, other.emin)
                && Arrays.equals(maxPProd, other.maxPProd)
                && Arrays.equals(maxPAbsorb, other.maxPAbsorb)
                && Arrays.equals(marginalCost, other.marginalCost)
                && Arrays.equals(loss, other.loss)
                && Arrays.equals(chargingEfficiency, other.chargingEfficiency)
                && Arrays.equals(dischargingEfficiency, other.dischargingEfficiency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(emax), Arrays.hashCode(maxPProd), Arrays.hashCode(maxPAbsorb));
    }

    public static final class Builder {

        private String[] types;
        private double[] emax;
        private double[] emin;
        private double[] maxPProd;
        private double[] maxPAbsorb;
        private double[] marginalCost;
        private double[] loss;
        private double[] chargingEfficiency;
        private double[] dischargingEfficiency;

        private Builder() {
        }

        public Builder setTypes(String... types) {
            this.types = Objects.requireNonNull(types);
            return this;
        }

        public Builder setEmax(double... emax) {
            this.emax = Objects.requireNonNull(emax);
            return this;
        }

        public Builder setEmin(double... emin) {
            this.emin = Objects.requireNonNull(emin);
            return this;
        }

        public Builder setMaxPProd(double... maxPProd) {
            this.maxPProd = Objects.requireNonNull(maxPProd);
            return this;
        }

        public Builder setMaxPAbsorb(double... maxPAbsorb) {
            this.maxPAbsorb = Objects.requireNonNull(maxPAbsorb);
            return this;
        }

        public Builder setMarginalCost(double... marginalCost) {
            this.marginalCost = Objects.requireNonNull(marginalCost);
            return this;
        }

        public Builder setLoss(double... loss) {
            this.loss = Objects.requireNonNull(loss);
            return this;
        }

        public Builder setChargingEfficiency(double... chargingEfficiency) {
            this.chargingEfficiency = Objects.requireNonNull(chargingEfficiency);
            return this;
        }

        public Builder setDischargingEfficiency(double... dischargingEfficiency) {
            this.dischargingEfficiency = Objects.requireNonNull(dischargingEfficiency);
            return this;
        }

        public StorageUnitData build() {
            if (emax == null || emin == null || maxPProd == null || maxPAbsorb == null) {
                throw new GridSchemaException("Storage unit data needs at least Emax, Emin, max p prod and max p absorb");
            }
            int count = emax.length;
            checkLength("Emin", emin, count);
            checkLength("max p prod", maxPProd, count);
            checkLength("max p absorb", maxPAbsorb, count);
            checkLength("marginal cost", marginalCost, count);
            checkLength("loss", loss, count);
            checkLength("charging efficiency", chargingEfficiency, count);
            checkLength("discharging efficiency", dischargingEfficiency, count);
            if (types != null && types.length != count) {
                throw new IncorrectNumberOfElementsException("Storage type has " + types.length + " values while Emax has " + count);
            }
            StorageUnitData data = new StorageUnitData(this);
            data.validate();
            return data;
        }

        private static void checkLength(String attribute, double[] values, int count) {
            if (values != null && values.length != count) {
                throw new IncorrectNumberOfElementsException("Storage " + attribute + " has " + values.length
                        + " values while Emax has " + count);
            }
        }
    }

    private void validate() {
        for (int storage = 0; storage < emax.length; storage++) {
            checkNonNegative("Emax", storage, emax[storage]);
            checkNonNegative("Emin", storage, emin[storage]);
            checkNonNegative("max p prod", storage, maxPProd[storage]);
            checkNonNegative("max p absorb", storage, maxPAbsorb[storage]);
            checkNonNegative("marginal cost", storage, marginalCost[storage]);
            checkNonNegative("loss", storage, loss[storage]);
            if (types[storage] == null) {
                throw new GridSchemaException("Storage unit " + storage + " has no type");
            }
            if (emin[storage] > emax[storage]) {
                throw new GridSchemaException("Storage unit " + storage + " has Emin " + emin[storage] + " above its Emax " + emax[storage]);
            }
            if (loss[storage] > maxPAbsorb[storage]) {
                throw new GridSchemaException("Storage unit " + storage + " loses more power than it can absorb");
            }
            double charging = chargingEfficiency[storage];
            if (!(charging >= 0 && charging <= 1)) {
                throw new GridSchemaException("Storage unit " + storage + " charging efficiency must be in [0, 1], got " + charging);
            }
            double discharging = dischargingEfficiency[storage];
            if (!(discharging > 0 && discharging <= 1)) {
                throw new GridSchemaException("Storage unit " + storage + " discharging efficiency must be in (0, 1], got " + discharging);
            }
        }
    }

    private static void checkNonNegative(String attribute, int storage, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new GridSchemaException("Storage unit " + storage + " has an invalid " + attribute + ": " + value);
        }
    }
}
