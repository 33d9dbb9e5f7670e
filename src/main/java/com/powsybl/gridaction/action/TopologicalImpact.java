/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Lines and substations syntactically touched by an action.
 *
 * @author PowSyBl grid action team
 */
public record TopologicalImpact(boolean[] linesImpacted, boolean[] subsImpacted) {

    public boolean isLineImpacted(int line) {
        return linesImpacted[line];
    }

    public boolean isSubstationImpacted(int sub) {
        return subsImpacted[sub];
    }

    public int[] getImpactedLines() {
        return IntStream.range(0, linesImpacted.length).filter(line -> linesImpacted[line]).toArray();
    }

    public int[] getImpactedSubstations() {
        return IntStream.range(0, subsImpacted.length).filter(sub -> subsImpacted[sub]).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TopologicalImpact other
                && Arrays.equals(linesImpacted, other.linesImpacted)
                && Arrays.equals(subsImpacted, other.subsImpacted);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(linesImpacted) + Arrays.hashCode(subsImpacted);
    }

    @Override
    public String toString() {
        return "TopologicalImpact(lines=" + Arrays.toString(getImpactedLines())
                + ", substations=" + Arrays.toString(getImpactedSubstations()) + ")";
    }
}
