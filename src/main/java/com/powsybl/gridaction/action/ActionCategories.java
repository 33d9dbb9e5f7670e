/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

/**
 * Kinds of modification an action performs. An action can be of several kinds, the do nothing
 * action is of none.
 *
 * @param injection load or generator active power is overridden
 * @param voltage generator voltage set points or shunts are modified
 * @param topology buses are set or changed (line status edits excluded)
 * @param line line status is set or changed
 * @param redispatching some generator is redispatched
 * @param storage storage set points are given
 *
 * @author PowSyBl grid action team
 */
public record ActionCategories(boolean injection, boolean voltage, boolean topology, boolean line,
                               boolean redispatching, boolean storage) {
}
