/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.exceptions;

/**
 * @author PowSyBl grid action team
 */
public class ElementOutOfRangeException extends GridActionException {

    private final String elementKind;

    private final int id;

    public ElementOutOfRangeException(String elementKind, int id, int count) {
        super("There is no " + elementKind + " with id " + id + " (the grid has " + count + " of them)");
        this.elementKind = elementKind;
        this.id = id;
    }

    public String getElementKind() {
        return elementKind;
    }

    public int getId() {
        return id;
    }
}
