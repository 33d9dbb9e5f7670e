/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.IllegalActionException;
import com.powsybl.gridaction.network.GridSchema;

import java.util.*;

/**
 * Decodes substation wide topologies: (substation, topology) pairs, a mapping from substation to
 * topology, or one value for every position of the topology vector.
 *
 * @author PowSyBl grid action team
 */
class SubstationInputDecoder {

    private final GridSchema schema;

    private final ElementInputDecoder substations;

    private final ElementInputDecoder topology;

    SubstationInputDecoder(GridSchema schema) {
        this.schema = Objects.requireNonNull(schema);
        substations = new ElementInputDecoder("substation", schema.getSubstationCount(), schema::indexOfSubstation, id -> id);
        topology = new ElementInputDecoder("topology position", schema.getDimTopo(), null, pos -> pos);
    }

    void applyInt(ElementInput input, int[] target) {
        for (Map.Entry<Object, Object> block : blocks(input)) {
            if (block.getKey() == null) {
                topology.applyInt(asInput(block.getValue()), target, ValueDomain.BUS);
            } else {
                substationDecoder(block.getKey()).applyInt(asInput(block.getValue()), target, ValueDomain.BUS);
            }
        }
    }

    void applyToggle(ElementInput input, boolean[] target) {
        for (Map.Entry<Object, Object> block : blocks(input)) {
            ElementInput values = asInput(block.getValue());
            if (!(values instanceof ElementInput.Dense dense && dense.values() instanceof boolean[])) {
                throw new IllegalActionException("The topology of a substation to change must be a boolean vector");
            }
            if (block.getKey() == null) {
                topology.applyToggle(values, target);
            } else {
                substationDecoder(block.getKey()).applyToggle(values, target);
            }
        }
    }

    /**
     * Splits the input in (substation, topology) blocks, a null substation standing for the whole grid.
     */
    private static List<Map.Entry<Object, Object>> blocks(ElementInput input) {
        Objects.requireNonNull(input);
        List<Map.Entry<Object, Object>> blocks = new ArrayList<>();
        if (input instanceof ElementInput.Pair pair) {
            blocks.add(new AbstractMap.SimpleEntry<>(pair.id(), pair.value()));
        } else if (input instanceof ElementInput.Pairs pairs) {
            pairs.pairs().forEach(pair -> blocks.add(new AbstractMap.SimpleEntry<>(pair.id(), pair.value())));
        } else if (input instanceof ElementInput.Mapping mapping) {
            mapping.values().forEach((sub, topo) -> blocks.add(new AbstractMap.SimpleEntry<>(sub, topo)));
        } else if (input instanceof ElementInput.Dense || input instanceof ElementInput.Ids) {
            blocks.add(new AbstractMap.SimpleEntry<>(null, input));
        } else {
            throw new IllegalActionException("A substation topology must be given as (substation, topology) pairs or as a full topology vector");
        }
        return blocks;
    }

    private ElementInputDecoder substationDecoder(Object substation) {
        int sub = substations.resolveId(substation);
        int start = schema.getSubstationStart(sub);
        return new ElementInputDecoder("element of substation " + sub, schema.getSubInfo(sub), null, i -> start + i);
    }

    private static ElementInput asInput(Object values) {
        if (values instanceof ElementInput.Dense || values instanceof ElementInput.Ids) {
            return (ElementInput) values;
        }
        if (values instanceof int[] || values instanceof boolean[]) {
            return new ElementInput.Dense(values);
        }
        if (values instanceof List<?> list) {
            if (!list.isEmpty() && list.stream().allMatch(Boolean.class::isInstance)) {
                boolean[] mask = new boolean[list.size()];
                for (int i = 0; i < mask.length; i++) {
                    mask[i] = (Boolean) list.get(i);
                }
                return new ElementInput.Dense(mask);
            }
            return new ElementInput.Ids(new ArrayList<>(list));
        }
        throw new IllegalActionException("Invalid substation topology " + values);
    }
}
