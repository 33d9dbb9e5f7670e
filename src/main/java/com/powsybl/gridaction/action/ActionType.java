/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.network.GridSchema;

import java.util.*;

import static com.powsybl.gridaction.action.ActionAttribute.*;

/**
 * Restricted families of actions, each one supporting a fixed set of attributes. Shunt attributes
 * are only effective on grids supporting shunts.
 *
 * @author PowSyBl grid action team
 */
public enum ActionType {
    DO_NOTHING(),
    PLAYABLE(SET_LINE_STATUS, CHANGE_LINE_STATUS, SET_BUS, CHANGE_BUS, REDISPATCH, STORAGE_POWER),
    TOPOLOGY(SET_LINE_STATUS, CHANGE_LINE_STATUS, SET_BUS, CHANGE_BUS),
    TOPOLOGY_SET(SET_LINE_STATUS, SET_BUS),
    TOPOLOGY_CHANGE(CHANGE_LINE_STATUS, CHANGE_BUS),
    DISPATCH(REDISPATCH),
    TOPOLOGY_AND_DISPATCH(SET_LINE_STATUS, CHANGE_LINE_STATUS, SET_BUS, CHANGE_BUS, REDISPATCH),
    POWERLINE_SET(SET_LINE_STATUS),
    POWERLINE_CHANGE(CHANGE_LINE_STATUS),
    STORAGE(STORAGE_POWER),
    COMPLETE(ActionAttribute.values());

    private final Set<ActionAttribute> attributes;

    ActionType(ActionAttribute... attributes) {
        EnumSet<ActionAttribute> set = EnumSet.noneOf(ActionAttribute.class);
        set.addAll(Arrays.asList(attributes));
        this.attributes = Collections.unmodifiableSet(set);
    }

    public Set<ActionAttribute> getAttributes() {
        return attributes;
    }

    public boolean supports(ActionAttribute attribute) {
        return attributes.contains(attribute);
    }

    /**
     * Attributes of this type that are effective on the given grid, in declaration order.
     */
    public List<ActionAttribute> getAttributes(GridSchema schema) {
        boolean shunts = schema.getCapabilities().shunts();
        return attributes.stream()
                .filter(attribute -> shunts || !attribute.isShunt())
                .toList();
    }
}
