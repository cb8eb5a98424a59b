/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.ingestion.schema;

/**
 * Field types of the target ERP models.
 */
public enum FieldType {

    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    DATE,
    DATETIME,
    /** A string restricted to the field's allowed values. */
    SELECTION,
    /** Single reference, encoded {@code [id, label]}. */
    MANY2ONE,
    /** Multi reference, encoded as an array of ids. */
    X2MANY,
    /** Array of nested objects described by the field's item schema. */
    OBJECT_ARRAY;

    public boolean isRelationship() {
        return this == MANY2ONE || this == X2MANY;
    }
}
