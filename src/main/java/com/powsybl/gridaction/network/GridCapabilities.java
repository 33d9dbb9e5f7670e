/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

/**
 * Features a grid schema supports, computed once when the schema is built.
 *
 * @param redispatching generator dispatch data is available
 * @param storage the grid has storage units with their static data
 * @param shunts shunts can be acted upon
 *
 * @author PowSyBl grid action team
 */
public record GridCapabilities(boolean redispatching, boolean storage, boolean shunts) {
}
