/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.exceptions;

/**
 * Grid schema integrity error, raised at construction or when a vector does not match the schema.
 *
 * @author PowSyBl grid action team
 */
public class GridSchemaException extends GridActionException {

    public GridSchemaException(String message) {
        super(message);
    }

    public GridSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
