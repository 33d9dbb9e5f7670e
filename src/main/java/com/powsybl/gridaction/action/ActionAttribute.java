/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.network.GridSchema;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Attributes of an action, declared in the order used by the flat vector encoding.
 *
 * @author PowSyBl grid action team
 */
public enum ActionAttribute {
    PROD_P("prod_p", ValueDomain.FLOAT, GridSchema::getGeneratorCount),
    PROD_V("prod_v", ValueDomain.FLOAT, GridSchema::getGeneratorCount),
    LOAD_P("load_p", ValueDomain.FLOAT, GridSchema::getLoadCount),
    LOAD_Q("load_q", ValueDomain.FLOAT, GridSchema::getLoadCount),
    REDISPATCH("redispatch", ValueDomain.FLOAT, GridSchema::getGeneratorCount),
    SET_LINE_STATUS("set_line_status", ValueDomain.LINE_STATUS, GridSchema::getLineCount),
    CHANGE_LINE_STATUS("change_line_status", ValueDomain.TOGGLE, GridSchema::getLineCount),
    SET_BUS("set_bus", ValueDomain.BUS, GridSchema::getDimTopo),
    CHANGE_BUS("change_bus", ValueDomain.TOGGLE, GridSchema::getDimTopo),
    HAZARDS("hazards", ValueDomain.TOGGLE, GridSchema::getLineCount),
    MAINTENANCE("maintenance", ValueDomain.TOGGLE, GridSchema::getLineCount),
    STORAGE_POWER("storage_power", ValueDomain.FLOAT, GridSchema::getStorageCount),
    SHUNT_P("shunt_p", ValueDomain.FLOAT, GridSchema::getShuntCount),
    SHUNT_Q("shunt_q", ValueDomain.FLOAT, GridSchema::getShuntCount),
    SHUNT_BUS("shunt_bus", ValueDomain.BUS, GridSchema::getShuntCount);

    private final String name;

    private final ValueDomain domain;

    private final ToIntFunction<GridSchema> dimension;

    ActionAttribute(String name, ValueDomain domain, ToIntFunction<GridSchema> dimension) {
        this.name = name;
        this.domain = domain;
        this.dimension = dimension;
    }

    public String getName() {
        return name;
    }

    public ValueDomain getDomain() {
        return domain;
    }

    public int getDimension(GridSchema schema) {
        return dimension.applyAsInt(schema);
    }

    public boolean isShunt() {
        return this == SHUNT_P || this == SHUNT_Q || this == SHUNT_BUS;
    }

    public static Optional<ActionAttribute> fromName(String name) {
        return Arrays.stream(values()).filter(attribute -> attribute.name.equals(name)).findFirst();
    }
}
