/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.network.ElementType;

import java.util.Arrays;
import java.util.Optional;

/**
 * Injection set points an action can override.
 *
 * @author PowSyBl grid action team
 */
public enum InjectionKey {
    LOAD_P(ActionAttribute.LOAD_P, ElementType.LOAD),
    LOAD_Q(ActionAttribute.LOAD_Q, ElementType.LOAD),
    PROD_P(ActionAttribute.PROD_P, ElementType.GENERATOR),
    PROD_V(ActionAttribute.PROD_V, ElementType.GENERATOR);

    private final ActionAttribute attribute;

    private final ElementType elementType;

    InjectionKey(ActionAttribute attribute, ElementType elementType) {
        this.attribute = attribute;
        this.elementType = elementType;
    }

    public ActionAttribute getAttribute() {
        return attribute;
    }

    public ElementType getElementType() {
        return elementType;
    }

    public String getName() {
        return attribute.getName();
    }

    public static Optional<InjectionKey> fromName(String name) {
        return Arrays.stream(values()).filter(key -> key.getName().equals(name)).findFirst();
    }
}
