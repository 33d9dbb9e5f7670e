/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

/**
 * Modifications an action performs on all the elements of one kind. Float values are NaN where
 * nothing is requested.
 *
 * @author PowSyBl grid action team
 */
public interface ElementModification {

    record LoadModification(double[] p, double[] q, int[] setBus, boolean[] changeBus) implements ElementModification {
    }

    record GeneratorModification(double[] p, double[] v, int[] setBus, boolean[] changeBus) implements ElementModification {
    }

    record StorageModification(double[] power, int[] setBus, boolean[] changeBus) implements ElementModification {
    }
}
