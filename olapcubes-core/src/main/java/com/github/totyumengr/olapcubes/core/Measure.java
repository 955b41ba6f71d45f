/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.olapcubes.core;

import java.util.Map;

import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named quantity aggregated by an {@link AggregationKind}. 
 * 
 * <p>An optional derivation formula is a <a href="https://docs.spring.io/spring-framework/reference/core/expressions.html">
 * SpEL</a> expression over the columns of a row, e.g. <code>work_hours * hourly_rate</code>. When present its value 
 * replaces the value of {@link #getSourceColumn()}. Its operands must be columns fetched for the cube, i.e. dimension 
 * columns or source columns of other measures.
 * 
 * @author mengran
 *
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Measure {
    
    private static final SpelExpressionParser PARSER = new SpelExpressionParser();
    
    private final String name;
    private final AggregationKind aggregation;
    private final String sourceColumn;
    private final String unit;
    private final String description;
    private final String formula;
    private final Double percentile;
    private final String function;
    
    private final transient Expression expression;
    
    @JsonCreator
    public Measure(@JsonProperty("name") String name, @JsonProperty("aggregation") AggregationKind aggregation, 
            @JsonProperty("source_column") String sourceColumn, @JsonProperty("unit") String unit, 
            @JsonProperty("description") String description, @JsonProperty("formula") String formula, 
            @JsonProperty("percentile") Double percentile, @JsonProperty("function") String function) {
        
        Assert.hasText(name, "Measure name can not empty.");
        Assert.notNull(aggregation, "Measure " + name + " must have an aggregation kind.");
        if (aggregation == AggregationKind.CUSTOM) {
            Assert.hasText(function, "Custom measure " + name + " must reference a function name.");
        }
        if (percentile != null) {
            Assert.isTrue(percentile >= 0 && percentile <= 100, "Percentile of measure " + name + " must between 0 and 100.");
        }
        
        this.name = name;
        this.aggregation = aggregation;
        this.formula = StringUtils.hasText(formula) ? formula : null;
        this.sourceColumn = StringUtils.hasText(sourceColumn) ? sourceColumn : (this.formula == null ? name : null);
        this.unit = unit;
        this.description = description;
        this.percentile = percentile;
        this.function = function;
        this.expression = this.formula == null ? null : PARSER.parseExpression(this.formula);
    }
    
    public static Builder builder(String name, AggregationKind aggregation) {
        return new Builder(name, aggregation);
    }
    
    /**
     * @param row raw row
     * @return source column value, or the derived value when a formula is defined
     * @throws AggregationException when formula evaluation failed
     */
    public Object valueOf(Map<String, Object> row) {
        
        if (expression == null) {
            return row.get(sourceColumn);
        }
        // Row columns only, no type references, constructors or method calls
        EvaluationContext context = SimpleEvaluationContext.forPropertyAccessors(new MapAccessor())
                .withRootObject(row).build();
        try {
            return expression.getValue(context);
        } catch (ExpressionException e) {
            throw new AggregationException("Can not evaluate formula '" + formula + "' of measure " + name 
                + ": " + e.getMessage(), e);
        }
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("aggregation")
    public AggregationKind getAggregation() {
        return aggregation;
    }

    @JsonProperty("source_column")
    public String getSourceColumn() {
        return sourceColumn;
    }

    @JsonProperty("unit")
    public String getUnit() {
        return unit;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("formula")
    public String getFormula() {
        return formula;
    }

    /**
     * @return rank used by {@link AggregationKind#PERCENTILE}, {@value Aggregators#DEFAULT_PERCENTILE} if not set
     */
    @JsonIgnore
    public double getPercentileRank() {
        return percentile == null ? Aggregators.DEFAULT_PERCENTILE : percentile;
    }
    
    @JsonProperty("percentile")
    public Double getPercentile() {
        return percentile;
    }

    @JsonProperty("function")
    public String getFunction() {
        return function;
    }

    @Override
    public String toString() {
        return "Measure [name=" + name + ", aggregation=" + aggregation.getCode() + ", sourceColumn=" + sourceColumn 
                + (formula == null ? "" : ", formula=" + formula) + "]";
    }
    
    /**
     * @author mengran
     *
     */
    public static class Builder {
        
        private final String name;
        private final AggregationKind aggregation;
        private String sourceColumn;
        private String unit;
        private String description;
        private String formula;
        private Double percentile;
        private String function;
        
        private Builder(String name, AggregationKind aggregation) {
            this.name = name;
            this.aggregation = aggregation;
        }
        
        public Builder sourceColumn(String sourceColumn) {
            this.sourceColumn = sourceColumn;
            return this;
        }
        
        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }
        
        public Builder description(String description) {
            this.description = description;
            return this;
        }
        
        public Builder formula(String formula) {
            this.formula = formula;
            return this;
        }
        
        public Builder percentile(double percentile) {
            this.percentile = percentile;
            return this;
        }
        
        public Builder function(String function) {
            this.function = function;
            return this;
        }
        
        public Measure build() {
            return new Measure(name, aggregation, sourceColumn, unit, description, formula, percentile, function);
        }
    }
}
