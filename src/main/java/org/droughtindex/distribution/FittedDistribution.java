/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A distribution together with its estimated parameters and, for zero-corrected fits, the
 * probability of a zero.
 *
 * <p>With zero correction the cumulative probability is a mixture of a point mass at zero and the
 * continuous family fit to the positive values:</p>
 * <pre>
 * P(X &lt;= x) = 0                    x &lt; 0
 *            = q                    x = 0
 *            = q + (1 - q) F(x)     x &gt; 0
 * </pre>
 */
public final class FittedDistribution implements Writeable, ToXContentObject {

    private final ContinuousDistribution distribution;
    private final double[] parameters;
    private final double zeroProbability;
    private final boolean zeroCorrected;
    private final int sampleSize;

    public FittedDistribution(
        ContinuousDistribution distribution,
        double[] parameters,
        double zeroProbability,
        boolean zeroCorrected,
        int sampleSize
    ) {
        this.distribution = Objects.requireNonNull(distribution, "distribution must not be null");
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null").clone();
        if (zeroProbability < 0.0 || zeroProbability > 1.0 || (zeroCorrected == false && zeroProbability != 0.0)) {
            throw new IllegalArgumentException("invalid zero probability [" + zeroProbability + "] for zeroCorrected=" + zeroCorrected);
        }
        this.zeroProbability = zeroProbability;
        this.zeroCorrected = zeroCorrected;
        this.sampleSize = sampleSize;
    }

    /**
     * Cumulative probability of {@code x}; {@code NaN} for a non-finite {@code x}.
     */
    public double cdf(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (zeroCorrected == false) {
            return distribution.cdf(x, parameters);
        }
        if (x < 0.0) {
            return 0.0;
        }
        if (x == 0.0) {
            return zeroProbability;
        }
        return zeroProbability + (1.0 - zeroProbability) * distribution.cdf(x, parameters);
    }

    public ContinuousDistribution getDistribution() {
        return distribution;
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    public double getZeroProbability() {
        return zeroProbability;
    }

    public boolean isZeroCorrected() {
        return zeroCorrected;
    }

    /**
     * @return number of finite values in the season, zeros included
     */
    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(distribution.name());
        out.writeDoubleArray(parameters);
        out.writeDouble(zeroProbability);
        out.writeBoolean(zeroCorrected);
        out.writeVInt(sampleSize);
    }

    public static FittedDistribution readFrom(StreamInput in, DistributionRegistry registry) throws IOException {
        ContinuousDistribution distribution = registry.get(in.readString());
        double[] parameters = in.readDoubleArray();
        double zeroProbability = in.readDouble();
        boolean zeroCorrected = in.readBoolean();
        int sampleSize = in.readVInt();
        return new FittedDistribution(distribution, parameters, zeroProbability, zeroCorrected, sampleSize);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("distribution", distribution.name());
        builder.startObject("parameters");
        List<String> names = distribution.parameterNames();
        for (int i = 0; i < parameters.length; i++) {
            builder.field(names.get(i), parameters[i]);
        }
        builder.endObject();
        builder.field("zero_corrected", zeroCorrected);
        if (zeroCorrected) {
            builder.field("zero_probability", zeroProbability);
        }
        builder.field("sample_size", sampleSize);
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FittedDistribution that = (FittedDistribution) o;
        return Double.compare(that.zeroProbability, zeroProbability) == 0
            && zeroCorrected == that.zeroCorrected
            && sampleSize == that.sampleSize
            && distribution.name().equals(that.distribution.name())
            && Arrays.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(distribution.name(), zeroProbability, zeroCorrected, sampleSize);
        return 31 * result + Arrays.hashCode(parameters);
    }

    @Override
    public String toString() {
        return distribution.name()
            + Arrays.toString(parameters)
            + (zeroCorrected ? "{q=" + zeroProbability + "}" : "")
            + "{n=" + sampleSize + "}";
    }
}
