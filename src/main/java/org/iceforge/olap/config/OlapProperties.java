package org.iceforge.olap.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.engine.stats.PercentileMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "olap")
public class OlapProperties {

    /**
     * Location of the semantic model YAML on the classpath.
     */
    @NotBlank
    private String modelResource = "semantic-model.yml";

    /**
     * Optional filesystem path of the semantic model. When set it wins over {@link #modelResource}, which lets
     * operators edit the model and trigger a reload without rebuilding.
     */
    private String modelLocation;

    /**
     * Placement of NULL group keys and NULL order-by values.
     */
    @NotNull
    private NullOrdering nullOrdering = NullOrdering.LAST;

    /**
     * Percentile estimator used by the statistics engine.
     */
    @NotNull
    private PercentileMethod percentileMethod = PercentileMethod.LINEAR;

    @Valid
    private Pareto pareto = new Pareto();

    public String getModelResource() {
        return modelResource;
    }

    public void setModelResource(String modelResource) {
        this.modelResource = modelResource;
    }

    public String getModelLocation() {
        return modelLocation;
    }

    public void setModelLocation(String modelLocation) {
        this.modelLocation = modelLocation;
    }

    public NullOrdering getNullOrdering() {
        return nullOrdering;
    }

    public void setNullOrdering(NullOrdering nullOrdering) {
        this.nullOrdering = nullOrdering;
    }

    public PercentileMethod getPercentileMethod() {
        return percentileMethod;
    }

    public void setPercentileMethod(PercentileMethod percentileMethod) {
        this.percentileMethod = percentileMethod;
    }

    public Pareto getPareto() {
        return pareto;
    }

    public void setPareto(Pareto pareto) {
        this.pareto = pareto;
    }

    /**
     * Default cumulative-percentage cut-offs of the A/B/C classification, in percent.
     */
    public static class Pareto {

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double classAThreshold = 80.0;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double classBThreshold = 95.0;

        public double getClassAThreshold() {
            return classAThreshold;
        }

        public void setClassAThreshold(double classAThreshold) {
            this.classAThreshold = classAThreshold;
        }

        public double getClassBThreshold() {
            return classBThreshold;
        }

        public void setClassBThreshold(double classBThreshold) {
            this.classBThreshold = classBThreshold;
        }
    }
}
