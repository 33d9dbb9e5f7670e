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
public class UnknownElementNameException extends GridActionException {

    private final String elementKind;

    private final String name;

    public UnknownElementNameException(String elementKind, String name) {
        super("No " + elementKind + " named '" + name + "' in the grid");
        this.elementKind = elementKind;
        this.name = name;
    }

    public String getElementKind() {
        return elementKind;
    }

    public String getName() {
        return name;
    }
}
