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

import java.math.BigDecimal;
import java.util.List;

/**
 * Concrete reduction function of one {@link AggregationKind}.
 * @author mengran
 *
 */
@FunctionalInterface
public interface Aggregator {

    /**
     * @param values raw column values of one group, may contain <code>null</code>
     * @return reduced value, <code>null</code> when nothing can be reduced
     * @throws AggregationException when values are not suitable for this reduction
     */
    BigDecimal aggregate(List<?> values);
}
