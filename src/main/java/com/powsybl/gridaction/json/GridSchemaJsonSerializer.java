/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.json.JsonUtil;
import com.powsybl.gridaction.exceptions.GridSchemaException;
import com.powsybl.gridaction.network.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON form of a {@link GridSchema}: element names, substations and positions, and the optional
 * dispatch, storage and shunt data.
 *
 * @author PowSyBl grid action team
 */
public final class GridSchemaJsonSerializer {

    private static final String SUBSTATION_NAMES = "substationNames";
    private static final String LOAD_NAMES = "loadNames";
    private static final String GENERATOR_NAMES = "generatorNames";
    private static final String LINE_NAMES = "lineNames";
    private static final String STORAGE_NAMES = "storageNames";
    private static final String TO_SUB_ID = "ToSubId";
    private static final String TO_SUB_POS = "ToSubPos";
    private static final String DISPATCH = "dispatch";
    private static final String STORAGE_DATA = "storageData";
    private static final String SHUNTS = "shunts";
    private static final String NAMES = "names";

    private GridSchemaJsonSerializer() {
    }

    private static String prefix(ElementType type) {
        return switch (type) {
            case LOAD -> "load";
            case GENERATOR -> "generator";
            case LINE_OR -> "lineOr";
            case LINE_EX -> "lineEx";
            case STORAGE -> "storage";
        };
    }

    public static void write(GridSchema schema, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(schema, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(GridSchema schema) {
        StringWriter writer = new StringWriter();
        write(schema, writer);
        return writer.toString();
    }

    public static void write(GridSchema schema, Writer writer) {
        Objects.requireNonNull(schema);
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();

            writeStrings(jsonGenerator, SUBSTATION_NAMES, schema.getSubstationNames());
            writeStrings(jsonGenerator, LOAD_NAMES, schema.getLoadNames());
            writeStrings(jsonGenerator, GENERATOR_NAMES, schema.getGeneratorNames());
            writeStrings(jsonGenerator, LINE_NAMES, schema.getLineNames());
            writeStrings(jsonGenerator, STORAGE_NAMES, schema.getStorageNames());
            for (ElementType type : ElementType.values()) {
                writeInts(jsonGenerator, prefix(type) + TO_SUB_ID, schema.getToSubId(type));
                writeInts(jsonGenerator, prefix(type) + TO_SUB_POS, schema.getToSubPos(type));
            }

            if (schema.getDispatchData().isPresent()) {
                GeneratorDispatchData data = schema.getDispatchData().get();
                jsonGenerator.writeFieldName(DISPATCH);
                jsonGenerator.writeStartObject();
                jsonGenerator.writeFieldName("types");
                jsonGenerator.writeStartArray();
                for (GeneratorType type : data.getTypes()) {
                    jsonGenerator.writeString(type.name());
                }
                jsonGenerator.writeEndArray();
                writeDoubles(jsonGenerator, "pmin", data.getPmin());
                writeDoubles(jsonGenerator, "pmax", data.getPmax());
                writeBooleans(jsonGenerator, "redispatchable", data.getRedispatchable());
                writeDoubles(jsonGenerator, "maxRampUp", data.getMaxRampUp());
                writeDoubles(jsonGenerator, "maxRampDown", data.getMaxRampDown());
                writeInts(jsonGenerator, "minUpTime", data.getMinUpTime());
                writeInts(jsonGenerator, "minDownTime", data.getMinDownTime());
                writeDoubles(jsonGenerator, "costPerMw", data.getCostPerMw());
                writeDoubles(jsonGenerator, "startupCost", data.getStartupCost());
                writeDoubles(jsonGenerator, "shutdownCost", data.getShutdownCost());
                jsonGenerator.writeEndObject();
            }

            if (schema.getStorageData().isPresent()) {
                StorageUnitData data = schema.getStorageData().get();
                jsonGenerator.writeFieldName(STORAGE_DATA);
                jsonGenerator.writeStartObject();
                writeStrings(jsonGenerator, "types", data.getTypes());
                writeDoubles(jsonGenerator, "emax", data.getEmax());
                writeDoubles(jsonGenerator, "emin", data.getEmin());
                writeDoubles(jsonGenerator, "maxPProd", data.getMaxPProd());
                writeDoubles(jsonGenerator, "maxPAbsorb", data.getMaxPAbsorb());
                writeDoubles(jsonGenerator, "marginalCost", data.getMarginalCost());
                writeDoubles(jsonGenerator, "loss", data.getLoss());
                writeDoubles(jsonGenerator, "chargingEfficiency", data.getChargingEfficiency());
                writeDoubles(jsonGenerator, "dischargingEfficiency", data.getDischargingEfficiency());
                jsonGenerator.writeEndObject();
            }

            if (schema.getCapabilities().shunts()) {
                jsonGenerator.writeFieldName(SHUNTS);
                jsonGenerator.writeStartObject();
                writeStrings(jsonGenerator, NAMES, schema.getShuntNames());
                writeInts(jsonGenerator, "toSubId", schema.getShuntData().orElseThrow().getShuntToSubId());
                jsonGenerator.writeEndObject();
            }

            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeStrings(JsonGenerator jsonGenerator, String field, String[] values) throws IOException {
        jsonGenerator.writeFieldName(field);
        jsonGenerator.writeStartArray();
        for (String value : values) {
            jsonGenerator.writeString(value);
        }
        jsonGenerator.writeEndArray();
    }

    private static void writeInts(JsonGenerator jsonGenerator, String field, int[] values) throws IOException {
        jsonGenerator.writeFieldName(field);
        jsonGenerator.writeArray(values, 0, values.length);
    }

    private static void writeDoubles(JsonGenerator jsonGenerator, String field, double[] values) throws IOException {
        jsonGenerator.writeFieldName(field);
        jsonGenerator.writeArray(values, 0, values.length);
    }

    private static void writeBooleans(JsonGenerator jsonGenerator, String field, boolean[] values) throws IOException {
        jsonGenerator.writeFieldName(field);
        jsonGenerator.writeStartArray();
        for (boolean value : values) {
            jsonGenerator.writeBoolean(value);
        }
        jsonGenerator.writeEndArray();
    }

    public static GridSchema read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GridSchema fromJson(String json) {
        return read(new StringReader(json));
    }

    public static GridSchema read(Reader reader) {
        Objects.requireNonNull(reader);
        ObjectMapper objectMapper = JsonUtil.createObjectMapper();
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.isObject()) {
            throw new GridSchemaException("A grid schema must be a JSON object");
        }

        String[] substationNames = strings(root, SUBSTATION_NAMES);
        GridSchemaBuilder builder = GridSchema.builder()
                .setSubstationCount(substationNames.length)
                .setSubstationNames(substationNames)
                .setLoadNames(strings(root, LOAD_NAMES))
                .setGeneratorNames(strings(root, GENERATOR_NAMES))
                .setLineNames(strings(root, LINE_NAMES))
                .setStorageNames(strings(root, STORAGE_NAMES))
                .setLoadToSubId(ints(root, prefix(ElementType.LOAD) + TO_SUB_ID))
                .setGeneratorToSubId(ints(root, prefix(ElementType.GENERATOR) + TO_SUB_ID))
                .setLineOrToSubId(ints(root, prefix(ElementType.LINE_OR) + TO_SUB_ID))
                .setLineExToSubId(ints(root, prefix(ElementType.LINE_EX) + TO_SUB_ID))
                .setStorageToSubId(ints(root, prefix(ElementType.STORAGE) + TO_SUB_ID));
        for (ElementType type : ElementType.values()) {
            builder.setToSubPos(type, ints(root, prefix(type) + TO_SUB_POS));
        }

        JsonNode dispatch = root.get(DISPATCH);
        if (dispatch != null) {
            String[] typeNames = strings(dispatch, "types");
            GeneratorType[] types = new GeneratorType[typeNames.length];
            for (int i = 0; i < types.length; i++) {
                types[i] = GeneratorType.valueOf(typeNames[i]);
            }
            builder.setDispatchData(GeneratorDispatchData.builder()
                    .setTypes(types)
                    .setPmin(doubles(dispatch, "pmin"))
                    .setPmax(doubles(dispatch, "pmax"))
                    .setRedispatchable(booleans(dispatch, "redispatchable"))
                    .setMaxRampUp(doubles(dispatch, "maxRampUp"))
                    .setMaxRampDown(doubles(dispatch, "maxRampDown"))
                    .setMinUpTime(ints(dispatch, "minUpTime"))
                    .setMinDownTime(ints(dispatch, "minDownTime"))
                    .setCostPerMw(doubles(dispatch, "costPerMw"))
                    .setStartupCost(doubles(dispatch, "startupCost"))
                    .setShutdownCost(doubles(dispatch, "shutdownCost"))
                    .build());
        }

        JsonNode storage = root.get(STORAGE_DATA);
        if (storage != null) {
            builder.setStorageData(StorageUnitData.builder()
                    .setTypes(strings(storage, "types"))
                    .setEmax(doubles(storage, "emax"))
                    .setEmin(doubles(storage, "emin"))
                    .setMaxPProd(doubles(storage, "maxPProd"))
                    .setMaxPAbsorb(doubles(storage, "maxPAbsorb"))
                    .setMarginalCost(doubles(storage, "marginalCost"))
                    .setLoss(doubles(storage, "loss"))
                    .setChargingEfficiency(doubles(storage, "chargingEfficiency"))
                    .setDischargingEfficiency(doubles(storage, "dischargingEfficiency"))
                    .build());
        }

        JsonNode shunts = root.get(SHUNTS);
        if (shunts != null) {
            builder.setShuntData(new ShuntData(ints(shunts, "toSubId"), strings(shunts, NAMES)));
        }
        return builder.build();
    }

    private static JsonNode array(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw new GridSchemaException("Field '" + field + "' is missing or is not an array");
        }
        return node;
    }

    private static String[] strings(JsonNode parent, String field) {
        JsonNode node = array(parent, field);
        String[] values = new String[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asText();
        }
        return values;
    }

    private static int[] ints(JsonNode parent, String field) {
        JsonNode node = array(parent, field);
        int[] values = new int[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asInt();
        }
        return values;
    }

    private static double[] doubles(JsonNode parent, String field) {
        JsonNode node = array(parent, field);
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asDouble();
        }
        return values;
    }

    private static boolean[] booleans(JsonNode parent, String field) {
        JsonNode node = array(parent, field);
        boolean[] values = new boolean[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asBoolean();
        }
        return values;
    }
}
