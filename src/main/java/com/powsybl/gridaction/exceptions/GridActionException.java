/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.exceptions;

import com.powsybl.commons.PowsyblException;

/**
 * Root of all the errors raised when building a grid schema or manipulating grid actions.
 *
 * @author PowSyBl grid action team
 */
public class GridActionException extends PowsyblException {

    public GridActionException(String message) {
        super(message);
    }

    public GridActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
