/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

/**
 * Domain of the values an accessor writes.
 *
 * @author PowSyBl grid action team
 */
public enum ValueDomain {
    BUS(-1, 2),
    LINE_STATUS(-1, 1),
    TOGGLE(0, 1),
    FLOAT(Integer.MIN_VALUE, Integer.MAX_VALUE);

    private final int min;

    private final int max;

    ValueDomain(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }
}
