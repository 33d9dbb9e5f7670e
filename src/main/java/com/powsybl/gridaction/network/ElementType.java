/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

/**
 * Kinds of elements having a position in the topology vector. The column index is the one used by
 * {@link GridSchema#elementsOfSubstation(int)} and {@link GridSchema#getGridObjectsTypes()}, column 0
 * holding the substation id.
 *
 * @author PowSyBl grid action team
 */
public enum ElementType {
    LOAD("load", 1),
    GENERATOR("generator", 2),
    LINE_OR("line (origin side)", 3),
    LINE_EX("line (extremity side)", 4),
    STORAGE("storage unit", 5);

    public static final int SUBSTATION_COLUMN = 0;
    public static final int COLUMN_COUNT = 6;

    private final String label;

    private final int column;

    ElementType(String label, int column) {
        this.label = label;
        this.column = column;
    }

    public String getLabel() {
        return label;
    }

    public int getColumn() {
        return column;
    }
}
