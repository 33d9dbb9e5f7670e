/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

import java.util.Arrays;
import java.util.Objects;

/**
 * Shunts of a grid. Shunts have no position in the topology vector, only a substation.
 *
 * @author PowSyBl grid action team
 */
public final class ShuntData {

    private final int[] shuntToSubId;

    private final String[] names;

    public ShuntData(int[] shuntToSubId) {
        this(shuntToSubId, null);
    }

    /**
     * @param names shunt names, or null to get default names once attached to a schema
     */
    public ShuntData(int[] shuntToSubId, String[] names) {
        this.shuntToSubId = Objects.requireNonNull(shuntToSubId).clone();
        this.names = names != null ? names.clone() : null;
    }

    public int getShuntCount() {
        return shuntToSubId.length;
    }

    public int getSubstationId(int shunt) {
        return shuntToSubId[shunt];
    }

    public int[] getShuntToSubId() {
        return shuntToSubId.clone();
    }

    String[] getNames() {
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ShuntData other && Arrays.equals(shuntToSubId, other.shuntToSubId) && Arrays.equals(names, other.names);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(shuntToSubId);
    }
}
