package io.nosqlbench.downscale.state;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.downscale.grouping.DayOfMonthGrouping;
import io.nosqlbench.downscale.grouping.MonthGrouping;
import io.nosqlbench.downscale.grouping.PaddedDayOfYearGrouping;
import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.quantile.EmpiricalQuantileMap;
import io.nosqlbench.downscale.quantile.HistogramQuantileMap;
import io.nosqlbench.downscale.quantile.QuantileMap;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * GSON TypeAdapterFactory for polymorphic serialization of one base type.
 *
 * <p>Each registered implementation is written with a leading "type" field
 * taken from its {@link TypeName} annotation, followed by its own fields only.
 * On read, the "type" field selects the concrete class.
 *
 * <h2>Architecture</h2>
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  EmpiricalQuantileMap                   { "type": "empirical", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @TypeName("empirical")          1. Read "type" field
 *  2. Serialize type-specific fields      2. Lookup registered class
 *  3. Add "type" field to JSON            3. Deserialize with delegate
 *        │                                         │
 *        ▼                                         ▼
 *  { "type": "empirical",                 EmpiricalQuantileMap
 *    "references": [...], ... }
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Gson gson = new GsonBuilder()
 *     .registerTypeAdapterFactory(TypeDiscriminatorAdapterFactory.quantileMaps())
 *     .registerTypeAdapterFactory(TypeDiscriminatorAdapterFactory.timeGroupings())
 *     .create();
 * }</pre>
 *
 * @param <B> the polymorphic base type
 * @see TypeName
 */
public final class TypeDiscriminatorAdapterFactory<B> implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Class<B> baseType;
    private final Map<String, Class<? extends B>> typeToClass = new HashMap<>();
    private final Map<Class<? extends B>, String> classToType = new HashMap<>();

    private TypeDiscriminatorAdapterFactory(Class<B> baseType) {
        this.baseType = Objects.requireNonNull(baseType, "baseType cannot be null");
    }

    /**
     * Creates an empty factory for {@code baseType}.
     *
     * @param baseType the base type handled by the factory
     * @param <B> the base type
     * @return a factory with no registered implementations
     */
    public static <B> TypeDiscriminatorAdapterFactory<B> of(Class<B> baseType) {
        return new TypeDiscriminatorAdapterFactory<>(baseType);
    }

    /**
     * Creates a factory with all {@link QuantileMap} implementations registered.
     *
     * @return a configured factory
     */
    public static TypeDiscriminatorAdapterFactory<QuantileMap> quantileMaps() {
        return of(QuantileMap.class)
            .registerType(EmpiricalQuantileMap.class)
            .registerType(HistogramQuantileMap.class);
    }

    /**
     * Creates a factory with all {@link TimeGrouping} variants registered.
     *
     * @return a configured factory
     */
    public static TypeDiscriminatorAdapterFactory<TimeGrouping> timeGroupings() {
        return of(TimeGrouping.class)
            .registerType(MonthGrouping.class)
            .registerType(DayOfMonthGrouping.class)
            .registerType(PaddedDayOfYearGrouping.class);
    }

    /**
     * Registers an implementation type under its {@link TypeName}.
     *
     * @param implClass the implementation class to register
     * @return this factory
     * @throws IllegalArgumentException if the class has no TypeName annotation
     *         or if the type name is already registered
     */
    public TypeDiscriminatorAdapterFactory<B> registerType(Class<? extends B> implClass) {
        TypeName annotation = implClass.getAnnotation(TypeName.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + implClass.getName() + " has no @TypeName annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " +
                typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, implClass);
        classToType.put(implClass, typeName);
        return this;
    }

    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!baseType.isAssignableFrom(type.getRawType())) {
            return null;
        }
        return new DiscriminatedAdapter<>(gson);
    }

    private Class<? extends B> classFor(JsonObject json) {
        JsonElement name = json.remove(TYPE_FIELD);
        if (name == null || !name.isJsonPrimitive()) {
            throw new IllegalArgumentException(
                baseType.getSimpleName() + " JSON has no '" + TYPE_FIELD + "' field: " + json);
        }
        Class<? extends B> implClass = typeToClass.get(name.getAsString());
        if (implClass == null) {
            throw new IllegalArgumentException(String.format(
                "Unknown %s type '%s', expected one of %s",
                baseType.getSimpleName(), name.getAsString(), typeToClass.keySet()));
        }
        return implClass;
    }

    private String nameFor(Class<?> implClass) {
        String name = classToType.get(implClass);
        if (name == null) {
            throw new IllegalArgumentException(
                "Unregistered " + baseType.getSimpleName() + " type: " + implClass.getName());
        }
        return name;
    }

    /// Writes `{"type": name, ...fields}` and reads it back through the
    /// reflective adapter of the named class.
    private final class DiscriminatedAdapter<T> extends TypeAdapter<T> {

        private final Gson gson;
        private final TypeAdapter<JsonElement> trees;

        private DiscriminatedAdapter(Gson gson) {
            this.gson = gson;
            this.trees = gson.getAdapter(JsonElement.class);
        }

        private <C> TypeAdapter<C> fieldsAdapter(Class<C> implClass) {
            return gson.getDelegateAdapter(TypeDiscriminatorAdapterFactory.this, TypeToken.get(implClass));
        }

        @Override
        @SuppressWarnings("unchecked")
        public void write(JsonWriter out, T value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            Class<T> implClass = (Class<T>) value.getClass();
            JsonObject tagged = new JsonObject();
            tagged.addProperty(TYPE_FIELD, nameFor(implClass));
            fieldsAdapter(implClass).toJsonTree(value).getAsJsonObject().entrySet()
                .forEach(field -> tagged.add(field.getKey(), field.getValue()));
            trees.write(out, tagged);
        }

        @Override
        @SuppressWarnings("unchecked")
        public T read(JsonReader in) throws IOException {
            JsonElement element = trees.read(in);
            if (element == null || element.isJsonNull()) {
                return null;
            }
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException(
                    "Expected a JSON object for " + baseType.getSimpleName() + ", got " + element);
            }
            JsonObject json = element.getAsJsonObject();
            return (T) fieldsAdapter(classFor(json)).fromJsonTree(json);
        }
    }

    /**
     * Returns the type name for a registered class, or null.
     *
     * @param implClass the implementation class
     * @return the type name, or null if not registered
     */
    public String getTypeName(Class<? extends B> implClass) {
        return classToType.get(implClass);
    }
}
