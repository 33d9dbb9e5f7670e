/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

/**
 * Pending modifications of an action touching one element, as returned by {@link GridAction#effectOn(EffectQuery)}.
 * Injection values are NaN when not overridden, bus assignments 0 when not set.
 *
 * @author PowSyBl grid action team
 */
public interface ElementEffect {

    record LoadEffect(double newP, double newQ, int setBus, boolean changeBus) implements ElementEffect {
    }

    record GeneratorEffect(double newP, double newV, int setBus, boolean changeBus, double redispatch) implements ElementEffect {
    }

    record LineEffect(int setBusOr, boolean changeBusOr, int setBusEx, boolean changeBusEx,
                      int setLineStatus, boolean changeLineStatus) implements ElementEffect {
    }

    record StorageEffect(double power, int setBus, boolean changeBus) implements ElementEffect {
    }

    record SubstationEffect(int substationId, int[] setBus, boolean[] changeBus) implements ElementEffect {
    }
}
