/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Selects the element whose pending modifications are queried. Exactly one selector must be set.
 *
 * @author PowSyBl grid action team
 */
public class EffectQuery {

    private Integer loadId;
    private Integer generatorId;
    private Integer lineId;
    private Integer storageId;
    private Integer substationId;

    public static EffectQuery load(int loadId) {
        return new EffectQuery().setLoadId(loadId);
    }

    public static EffectQuery generator(int generatorId) {
        return new EffectQuery().setGeneratorId(generatorId);
    }

    public static EffectQuery line(int lineId) {
        return new EffectQuery().setLineId(lineId);
    }

    public static EffectQuery storage(int storageId) {
        return new EffectQuery().setStorageId(storageId);
    }

    public static EffectQuery substation(int substationId) {
        return new EffectQuery().setSubstationId(substationId);
    }

    public Integer getLoadId() {
        return loadId;
    }

    public EffectQuery setLoadId(Integer loadId) {
        this.loadId = loadId;
        return this;
    }

    public Integer getGeneratorId() {
        return generatorId;
    }

    public EffectQuery setGeneratorId(Integer generatorId) {
        this.generatorId = generatorId;
        return this;
    }

    public Integer getLineId() {
        return lineId;
    }

    public EffectQuery setLineId(Integer lineId) {
        this.lineId = lineId;
        return this;
    }

    public Integer getStorageId() {
        return storageId;
    }

    public EffectQuery setStorageId(Integer storageId) {
        this.storageId = storageId;
        return this;
    }

    public Integer getSubstationId() {
        return substationId;
    }

    public EffectQuery setSubstationId(Integer substationId) {
        this.substationId = substationId;
        return this;
    }

    long getSelectorCount() {
        return Stream.of(loadId, generatorId, lineId, storageId, substationId).filter(Objects::nonNull).count();
    }
}
