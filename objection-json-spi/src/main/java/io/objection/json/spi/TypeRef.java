package io.objection.json.spi;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a full generic type for {@link JsonNode#toObject(TypeRef)}. Create it as an anonymous
 * subclass so the type argument survives erasure:
 * <pre>{@code
 * TypeRef<List<Item>> items = new TypeRef<>() {};
 * }</pre>
 *
 * @param <T> the captured type
 */
public abstract class TypeRef<T> {
    private final Type type;

    protected TypeRef() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType)) {
            throw new IllegalStateException("TypeRef must be created with a type argument");
        }
        this.type = ((ParameterizedType) superclass).getActualTypeArguments()[0];
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return type.getTypeName();
    }
}
