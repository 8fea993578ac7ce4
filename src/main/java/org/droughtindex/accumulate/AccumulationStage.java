/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.accumulate;

import org.droughtindex.accumulate.window.SumWindow;
import org.droughtindex.accumulate.window.WindowTransformer;
import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.core.model.SampleList;
import org.droughtindex.core.model.TimeSeries;
import org.droughtindex.pipeline.stage.PipelineStage;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Pipeline stage computing the trailing sum of a series over a window of configurable length.
 * <p>
 * The window is strictly trailing: the value at a timestamp only depends on that observation and
 * the ones before it. Timestamps without a full window of history produce no output, so for
 * {@link AccumulationUnit#STEPS} the output has {@code n - (window - 1)} samples. A window that holds
 * a non-finite value yields {@link Double#NaN}.
 */
public class AccumulationStage implements PipelineStage {
    /** The name of this stage. */
    public static final String NAME = "accumulate";

    private final int window;
    private final AccumulationUnit unit;
    private final ZoneId zone;

    /**
     * Creates a count based accumulation stage.
     *
     * @param window number of observations per window
     */
    public AccumulationStage(int window) {
        this(window, AccumulationUnit.STEPS, ZoneOffset.UTC);
    }

    /**
     * @param window window length in {@code unit}
     * @param unit unit of the window length
     * @param zone zone used to step back calendar units
     */
    public AccumulationStage(int window, AccumulationUnit unit, ZoneId zone) {
        if (window <= 0) {
            throw new ConfigurationException("accumulation window must be positive, got [{}]", window);
        }
        this.window = window;
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public TimeSeries process(TimeSeries input) {
        if (input == null) {
            throw new NullPointerException(getName() + " stage received null input");
        }
        if (window == 1) {
            return input;
        }
        return unit == AccumulationUnit.STEPS ? accumulateSteps(input) : accumulateCalendar(input);
    }

    private TimeSeries accumulateSteps(TimeSeries input) {
        SampleList samples = input.getSamples();
        int outputSize = Math.max(0, samples.size() - (window - 1));
        long[] timestamps = new long[outputSize];
        double[] sums = new double[outputSize];

        WindowTransformer sumWindow = new SumWindow(window);
        int out = 0;
        for (int i = 0; i < samples.size(); i++) {
            sumWindow.add(samples.getValue(i));
            if (sumWindow.isFull()) {
                timestamps[out] = samples.getTimestamp(i);
                sums[out] = sumWindow.value();
                out++;
            }
        }
        return input.withSamples(SampleList.of(timestamps, sums));
    }

    /**
     * Calendar windows hold the observations whose period lies in the {@code window} periods ending
     * with the current one. A window is complete when the series starts in or before its oldest period.
     */
    private TimeSeries accumulateCalendar(TimeSeries input) {
        SampleList samples = input.getSamples();
        if (samples.isEmpty()) {
            return input;
        }
        long[] periods = new long[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            periods[i] = unit.periodIndex(samples.getTimestamp(i), zone);
        }
        long[] timestamps = new long[samples.size()];
        double[] sums = new double[samples.size()];
        int out = 0;
        int lo = 0;
        for (int i = 0; i < samples.size(); i++) {
            long oldestPeriod = periods[i] - (window - 1L);
            while (lo < i && periods[lo] < oldestPeriod) {
                lo++;
            }
            if (periods[0] > oldestPeriod) {
                continue;
            }
            double sum = 0.0;
            for (int j = lo; j <= i; j++) {
                sum += samples.getValue(j);
            }
            timestamps[out] = samples.getTimestamp(i);
            sums[out] = Double.isFinite(sum) ? sum : Double.NaN;
            out++;
        }
        return input.withSamples(SampleList.of(Arrays.copyOf(timestamps, out), Arrays.copyOf(sums, out)));
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getWindow() {
        return window;
    }

    public AccumulationUnit getUnit() {
        return unit;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("window", window);
        builder.field("unit", unit.toString().toLowerCase(Locale.ROOT));
        builder.field("time_zone", zone.getId());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVInt(window);
        unit.writeTo(out);
        out.writeString(zone.getId());
    }

    /**
     * Deserializes an AccumulationStage from a stream.
     *
     * @param in the input stream
     * @return the deserialized AccumulationStage
     * @throws IOException if an I/O error occurs
     */
    public static AccumulationStage readFrom(StreamInput in) throws IOException {
        int window = in.readVInt();
        AccumulationUnit unit = AccumulationUnit.readFrom(in);
        ZoneId zone = ZoneId.of(in.readString());
        return new AccumulationStage(window, unit, zone);
    }

    /**
     * Creates an AccumulationStage from a map of arguments: {@code window} (required),
     * {@code unit} and {@code time_zone} (optional).
     *
     * @param args the argument map
     * @return the created AccumulationStage
     * @throws IllegalArgumentException if required parameters are missing
     */
    public static AccumulationStage fromArgs(Map<String, Object> args) {
        Object window = args.get("window");
        if (window == null) {
            throw new IllegalArgumentException("AccumulationStage requires 'window' parameter");
        }
        if (window instanceof Number == false) {
            throw new IllegalArgumentException("AccumulationStage 'window' must be a number, got: " + window);
        }
        AccumulationUnit unit = args.containsKey("unit") ? AccumulationUnit.fromString((String) args.get("unit")) : AccumulationUnit.STEPS;
        ZoneId zone = args.containsKey("time_zone") ? ZoneId.of((String) args.get("time_zone")) : ZoneOffset.UTC;
        return new AccumulationStage(((Number) window).intValue(), unit, zone);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        AccumulationStage that = (AccumulationStage) obj;
        return window == that.window && unit == that.unit && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(window, unit, zone);
    }

    @Override
    public String toString() {
        return "AccumulationStage{window=" + window + ", unit=" + unit + ", zone=" + zone + '}';
    }
}
