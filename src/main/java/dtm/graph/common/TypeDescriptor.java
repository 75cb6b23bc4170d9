package dtm.graph.common;

import dtm.graph.annotations.Embeddable;
import dtm.graph.prototypes.FieldKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.Map;

/**
 * Identidade de tempo de execução do tipo de um valor.
 * <p>
 * Usado como chave do índice de tipos e para as verificações de igualdade e
 * atribuição feitas pelo resolvedor.
 */
@Getter
@EqualsAndHashCode
public final class TypeDescriptor {

    private final Class<?> type;

    private TypeDescriptor(Class<?> type) {
        this.type = type;
    }

    public static TypeDescriptor of(@NonNull Object value){
        return new TypeDescriptor(value.getClass());
    }

    public static TypeDescriptor ofType(@NonNull Class<?> type){
        return new TypeDescriptor(type);
    }

    /**
     * Verifica se o tipo é uma referência a uma classe concreta comum, a única forma
     * aceita como objeto sem nome do grafo.
     *
     * @return {@code false} para primitivos, wrappers, {@code String}, enums, arrays,
     *         coleções, mapas, anotações, interfaces, classes abstratas e lambdas
     */
    public boolean isPointerToRecord(){
        if (type.isPrimitive() || type.isArray() || type.isEnum() || type.isAnnotation()) {
            return false;
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        if (type.isSynthetic() || type.isHidden() || type == Object.class) {
            return false;
        }
        if (isValueType(type)) {
            return false;
        }
        return !Map.class.isAssignableFrom(type) && !Collection.class.isAssignableFrom(type);
    }

    /**
     * Indica se um valor deste tipo pode ocupar um campo declarado como {@code target},
     * seja por igualdade, herança ou implementação de interface.
     */
    public boolean isAssignableTo(@NonNull TypeDescriptor target){
        return wrap(target.type).isAssignableFrom(wrap(type));
    }

    /**
     * Forma de um campo declarado com este tipo.
     */
    public FieldKind getFieldKind(){
        if (type.isPrimitive() || type.isArray() || type.isEnum() || type.isAnnotation()) {
            return FieldKind.UNSUPPORTED;
        }
        if (Collection.class.isAssignableFrom(type) || isValueType(type)) {
            return FieldKind.UNSUPPORTED;
        }
        if (Map.class.isAssignableFrom(type)) {
            return FieldKind.MAP;
        }
        if (type.isAnnotationPresent(Embeddable.class)) {
            return FieldKind.RECORD;
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return FieldKind.INTERFACE;
        }
        return isPointerToRecord() ? FieldKind.POINTER : FieldKind.UNSUPPORTED;
    }

    @Override
    public String toString() {
        return type.getTypeName();
    }

    private static boolean isValueType(Class<?> clazz){
        return clazz == String.class
                || clazz == Boolean.class
                || clazz == Character.class
                || Number.class.isAssignableFrom(clazz);
    }

    private static Class<?> wrap(Class<?> clazz){
        if (!clazz.isPrimitive()) return clazz;
        if (clazz == int.class) return Integer.class;
        if (clazz == long.class) return Long.class;
        if (clazz == boolean.class) return Boolean.class;
        if (clazz == double.class) return Double.class;
        if (clazz == float.class) return Float.class;
        if (clazz == short.class) return Short.class;
        if (clazz == byte.class) return Byte.class;
        if (clazz == char.class) return Character.class;
        return Void.class;
    }
}
