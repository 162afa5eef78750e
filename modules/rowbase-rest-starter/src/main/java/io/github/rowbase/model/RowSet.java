/*
 * Copyright 2025 Rowbase Team and/or its affiliates
 * and other contributors as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.rowbase.model;

/**
 * Forward only sequence of rows of one data model. Consumed once; rows come in the order of
 * the underlying result.
 */
public interface RowSet extends AutoCloseable {

    DataModel getDataModel();

    /**
     * Advance to the next row.
     *
     * @return false when there are no more rows
     */
    boolean next();

    /**
     * The current row. Only valid after {@link #next()} returned true.
     */
    Row getRow();

    @Override
    void close();
}
