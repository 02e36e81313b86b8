package io.artifacttracker.json.spi;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Objects;

/**
 * Captures a full generic type for deserialization.
 *
 * <p>Either subclass anonymously to capture a type known at compile time:
 * <pre>{@code
 * JsonType<List<Defect>> type = new JsonType<List<Defect>>() {};
 * }</pre>
 * or compose one at runtime when a type argument is only known as a {@link Class}:
 * <pre>{@code
 * JsonType<QueryResponse<T>> type = JsonType.parameterized(QueryResponse.class, artifactClass);
 * }</pre>
 */
public abstract class JsonType<T> {

    private final Type type;

    protected JsonType() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType)) {
            throw new IllegalStateException("JsonType must be created with a type argument");
        }
        this.type = ((ParameterizedType) superclass).getActualTypeArguments()[0];
    }

    private JsonType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public final Type getType() {
        return type;
    }

    public static <T> JsonType<T> of(Class<T> type) {
        return new JsonType<>(type) {};
    }

    /**
     * Builds {@code raw<arguments...>}. The caller asserts that {@code T} matches the composed type.
     */
    public static <T> JsonType<T> parameterized(Class<?> raw, Type... arguments) {
        Objects.requireNonNull(raw, "raw");
        if (raw.getTypeParameters().length != arguments.length) {
            throw new IllegalArgumentException(raw.getName() + " expects " + raw.getTypeParameters().length
                    + " type arguments, got " + arguments.length);
        }
        return new JsonType<>(new Parameterized(raw, arguments.clone())) {};
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonType<?> && type.equals(((JsonType<?>) o).type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.getTypeName();
    }

    private static final class Parameterized implements ParameterizedType {
        private final Class<?> raw;
        private final Type[] arguments;

        Parameterized(Class<?> raw, Type[] arguments) {
            this.raw = raw;
            this.arguments = arguments;
        }

        @Override
        public Type[] getActualTypeArguments() {
            return arguments.clone();
        }

        @Override
        public Type getRawType() {
            return raw;
        }

        @Override
        public Type getOwnerType() {
            return raw.getDeclaringClass();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ParameterizedType)) return false;
            ParameterizedType other = (ParameterizedType) o;
            return raw.equals(other.getRawType())
                    && Objects.equals(getOwnerType(), other.getOwnerType())
                    && Arrays.equals(arguments, other.getActualTypeArguments());
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(arguments) ^ raw.hashCode() ^ Objects.hashCode(getOwnerType());
        }

        @Override
        public String getTypeName() {
            StringBuilder sb = new StringBuilder(raw.getTypeName()).append('<');
            for (int i = 0; i < arguments.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments[i].getTypeName());
            }
            return sb.append('>').toString();
        }

        @Override
        public String toString() {
            return getTypeName();
        }
    }
}
