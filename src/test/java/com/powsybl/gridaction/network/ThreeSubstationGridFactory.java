/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

/**
 * <p>3 substation test grid:</p>
 *<pre>
 *   A (G1) ------ AB ------ B (L1, S1)
 *      \                    |
 *       AC                  BC
 *         \                 |
 *          ------------- C (L2, G2, SH1)
 *</pre>
 * Topology vector: A = [G1, AB or, AC or], B = [L1, BC or, AB ex, S1], C = [L2, G2, BC ex, AC ex].
 *
 * @author PowSyBl grid action team
 */
public final class ThreeSubstationGridFactory {

    public static final int DIM_TOPO = 11;

    private ThreeSubstationGridFactory() {
    }

    public static GridSchemaBuilder builder() {
        return GridSchema.builder()
                .setSubstationCount(3)
                .setLoadToSubId(1, 2)
                .setGeneratorToSubId(0, 2)
                .setLineOrToSubId(0, 1, 0)
                .setLineExToSubId(1, 2, 2)
                .setStorageToSubId(1)
                .setSubstationNames("A", "B", "C")
                .setLoadNames("L1", "L2")
                .setGeneratorNames("G1", "G2")
                .setLineNames("AB", "BC", "AC")
                .setStorageNames("S1");
    }

    public static GeneratorDispatchData createDispatchData() {
        return GeneratorDispatchData.builder()
                .setTypes(GeneratorType.THERMAL, GeneratorType.WIND)
                .setPmin(10, 0)
                .setPmax(100, 50)
                .setRedispatchable(true, false)
                .setMaxRampUp(20, 0)
                .setMaxRampDown(15, 0)
                .build();
    }

    public static StorageUnitData createStorageData() {
        return StorageUnitData.builder()
                .setEmax(10)
                .setEmin(0)
                .setMaxPProd(5)
                .setMaxPAbsorb(4)
                .build();
    }

    /**
     * Grid with dispatch, storage and shunt data.
     */
    public static GridSchema create() {
        return builder()
                .setDispatchData(createDispatchData())
                .setStorageData(createStorageData())
                .setShuntData(new ShuntData(new int[] {2}, new String[] {"SH1"}))
                .build();
    }

    /**
     * Same elements, without any static data.
     */
    public static GridSchema createWithoutStaticData() {
        return builder().build();
    }
}
