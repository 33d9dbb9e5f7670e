/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.exceptions;

/**
 * An action vector whose length does not match the dimension the grid schema expects for it.
 *
 * @author PowSyBl grid action team
 */
public class InvalidNumberOfElementsException extends AmbiguousActionException {

    private final String attribute;

    private final int expected;

    private final int actual;

    public InvalidNumberOfElementsException(String attribute, int expected, int actual) {
        super("Wrong number of elements for '" + attribute + "': " + actual + " values provided but the grid expects " + expected);
        this.attribute = attribute;
        this.expected = expected;
        this.actual = actual;
    }

    public String getAttribute() {
        return attribute;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
