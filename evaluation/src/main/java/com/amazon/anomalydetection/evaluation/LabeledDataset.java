/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalydetection.evaluation;

import static com.amazon.anomalydetection.CommonUtils.checkArgument;
import static com.amazon.anomalydetection.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * An ordered collection of labeled scalar observations. A data set can be
 * filled point by point, loaded from a delimited text file or generated from a
 * normal distribution with injected anomalies. Generation draws from the
 * data set's own {@link Random}, so a seeded data set is reproducible.
 */
@Slf4j
public class LabeledDataset {

    public static final double DEFAULT_DEVIATION_MULTIPLIER = 5.0;

    static final String CSV_HEADER = "value,is_anomaly,description";

    private static final Pattern SEPARATOR = Pattern.compile("[,;\t]");

    @Getter
    @Setter
    private String name;

    @Getter
    @Setter
    private String description = "";

    private final List<LabeledDataPoint> points = new ArrayList<>();

    private final Random random;

    public LabeledDataset(String name) {
        this(name, new Random());
    }

    public LabeledDataset(String name, long seed) {
        this(name, new Random(seed));
    }

    public LabeledDataset(String name, Random random) {
        this.name = checkNotNull(name, "name must not be null");
        this.random = checkNotNull(random, "random must not be null");
    }

    public void addPoint(LabeledDataPoint point) {
        points.add(checkNotNull(point, "point must not be null"));
    }

    public void addPoint(double value, boolean anomaly) {
        addPoint(new LabeledDataPoint(value, anomaly));
    }

    public void addPoint(double value, boolean anomaly, String description) {
        addPoint(new LabeledDataPoint(value, anomaly, description));
    }

    public void addPoints(double[] values, boolean[] labels) {
        checkNotNull(values, "values must not be null");
        checkNotNull(labels, "labels must not be null");
        checkArgument(values.length == labels.length, "values and labels must have the same length");
        for (int i = 0; i < values.length; i++) {
            addPoint(values[i], labels[i]);
        }
    }

    public void clear() {
        points.clear();
    }

    /**
     * @return a read-only view of the points in insertion order
     */
    public List<LabeledDataPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return the values of every point, in order
     */
    public double[] getValues() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * @return the values of the points labeled normal, in order
     */
    public double[] getNormalValues() {
        return points.stream().filter(p -> !p.isAnomaly()).mapToDouble(LabeledDataPoint::getValue).toArray();
    }

    public void loadFromCsv(Path path) throws IOException {
        loadFromCsv(path, 0, 1, true);
    }

    /**
     * Appends the rows of a delimited file. Fields may be separated by commas,
     * semicolons or tabs. A label of {@code 1}, {@code true} or {@code anomaly}
     * (case-insensitive) marks an anomaly, anything else is normal. Rows that
     * are too short or whose value does not parse are skipped.
     *
     * @param path        the file to read
     * @param valueColumn zero based index of the value column
     * @param labelColumn zero based index of the label column
     * @param hasHeader   whether the first line is a header
     * @return the number of points appended
     * @throws IOException if the file cannot be read
     */
    public int loadFromCsv(Path path, int valueColumn, int labelColumn, boolean hasHeader) throws IOException {
        checkNotNull(path, "path must not be null");
        checkArgument(valueColumn >= 0 && labelColumn >= 0, "column indices must be non-negative");
        int loaded = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (hasHeader && line != null) {
                line = reader.readLine();
            }
            for (; line != null; line = reader.readLine()) {
                String[] fields = SEPARATOR.split(line, -1);
                Double value = (fields.length > Math.max(valueColumn, labelColumn)) ? parse(fields[valueColumn]) : null;
                if (value == null) {
                    ++skipped;
                    continue;
                }
                addPoint(value, isAnomalyLabel(fields[labelColumn]));
                ++loaded;
            }
        }
        log.debug("loaded {} points from {}, skipped {} rows", loaded, path, skipped);
        return loaded;
    }

    /**
     * Writes the data set with a {@code value,is_anomaly,description} header so
     * that {@link #loadFromCsv(Path)} reads it back.
     *
     * @param path the file to write
     * @throws IOException if the file cannot be written
     */
    public void saveToCsv(Path path) throws IOException {
        checkNotNull(path, "path must not be null");
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (LabeledDataPoint point : points) {
                String text = (point.getDescription() == null) ? ""
                        : SEPARATOR.matcher(point.getDescription()).replaceAll(" ");
                writer.write(String.format(Locale.ROOT, "%s,%d,%s", Double.toString(point.getValue()),
                        point.isAnomaly() ? 1 : 0, text));
                writer.newLine();
            }
        }
    }

    public void generateNormalData(int count, double mean, double stdDev) {
        checkArgument(count >= 0, "count must be non-negative");
        checkArgument(stdDev >= 0, "stdDev must be non-negative");
        for (int i = 0; i < count; i++) {
            addPoint(mean + stdDev * random.nextGaussian(), false, "Normal");
        }
    }

    public void generateAnomalies(int count, double mean, double stdDev) {
        generateAnomalies(count, mean, stdDev, DEFAULT_DEVIATION_MULTIPLIER);
    }

    /**
     * Appends anomalies placed between {@code multiplier} and
     * {@code 2 * multiplier} standard deviations from the mean, on either side
     * with equal probability.
     */
    public void generateAnomalies(int count, double mean, double stdDev, double multiplier) {
        checkArgument(count >= 0, "count must be non-negative");
        checkArgument(stdDev >= 0, "stdDev must be non-negative");
        checkArgument(multiplier > 0, "multiplier must be positive");
        for (int i = 0; i < count; i++) {
            double offset = stdDev * multiplier * (1 + random.nextDouble());
            double value = random.nextBoolean() ? mean + offset : mean - offset;
            addPoint(value, true, "Anomaly");
        }
    }

    /**
     * Appends normal points and anomalies, then shuffles the whole data set.
     */
    public void generateMixedDataset(int normalCount, int anomalyCount, double mean, double stdDev) {
        generateNormalData(normalCount, mean, stdDev);
        generateAnomalies(anomalyCount, mean, stdDev);
        Collections.shuffle(points, random);
    }

    public int getAnomalyCount() {
        return (int) points.stream().filter(LabeledDataPoint::isAnomaly).count();
    }

    public int getNormalCount() {
        return points.size() - getAnomalyCount();
    }

    /**
     * @return the share of anomalies in percent, 0 for an empty data set
     */
    public double getAnomalyPercentage() {
        return points.isEmpty() ? 0 : 100.0 * getAnomalyCount() / points.size();
    }

    static boolean isAnomalyLabel(String field) {
        String label = field.trim().toLowerCase(Locale.ROOT);
        return label.equals("1") || label.equals("true") || label.equals("anomaly");
    }

    private static Double parse(String field) {
        try {
            double value = Double.parseDouble(field.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
