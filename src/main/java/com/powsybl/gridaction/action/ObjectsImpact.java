/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.network.ElementType;

import java.util.List;

/**
 * Detailed view of the grid objects an action modifies.
 *
 * @author PowSyBl grid action team
 */
public record ObjectsImpact(List<InjectionChange> injections,
                            int[] reconnectedLines,
                            int[] disconnectedLines,
                            int[] switchedLines,
                            List<BusEdit> busSwitches,
                            List<BusEdit> assignedBuses,
                            List<BusEdit> disconnectedElements,
                            List<RedispatchEntry> redispatches,
                            List<StorageEntry> storageSetPoints) {

    public record InjectionChange(InjectionKey key, double[] values) {
    }

    /**
     * @param bus the assigned bus, -1 for a disconnection, 0 for a bus switch
     */
    public record BusEdit(ElementType elementType, int elementId, int substationId, int bus) {
    }

    public record RedispatchEntry(int generatorId, String generatorName, double amount) {
    }

    public record StorageEntry(int storageId, String storageName, double power) {
    }

    public boolean hasImpact() {
        return !injections.isEmpty()
                || reconnectedLines.length > 0
                || disconnectedLines.length > 0
                || switchedLines.length > 0
                || !busSwitches.isEmpty()
                || !assignedBuses.isEmpty()
                || !disconnectedElements.isEmpty()
                || !redispatches.isEmpty()
                || !storageSetPoints.isEmpty();
    }
}
