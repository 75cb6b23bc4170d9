package dtm.graph.common;

import dtm.graph.annotations.Embeddable;
import dtm.graph.exceptions.DependencyGraphException;
import dtm.graph.exceptions.GraphErrorType;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FieldUtils {

    private FieldUtils(){
        throw new IllegalStateException("utility class");
    }

    /**
     * Retorna todos os campos de instância e estáticos da classe, incluindo os das superclasses,
     * na ordem de declaração, da subclasse para a superclasse. Campos sintéticos são ignorados.
     *
     * @param refClass Classe de referência.
     * @return Lista de campos declarados na hierarquia.
     */
    public static List<Field> getAllFields(Class<?> refClass){
        Objects.requireNonNull(refClass, "refClass não pode ser null");

        List<Field> fields = new ArrayList<>();

        while (refClass != null && refClass != Object.class) {
            for (Field field : refClass.getDeclaredFields()) {
                if (!field.isSynthetic()) {
                    fields.add(field);
                }
            }
            refClass = refClass.getSuperclass();
        }

        return fields;
    }

    /**
     * Verifica se o resolvedor pode atribuir o campo: não pode ser estático nem final,
     * e o acesso reflexivo precisa ser concedido.
     */
    public static boolean isSettable(Field field){
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers)) {
            return false;
        }
        try {
            return field.trySetAccessible();
        } catch (SecurityException e) {
            return false;
        }
    }

    /**
     * Verifica se o valor está no estado zero do seu tipo.
     * <p>
     * Referências nulas, números zero, {@code false}, {@code '\0'} e textos vazios são zero.
     * Arrays e valores {@link Embeddable} são zero quando todos os seus elementos ou campos são zero.
     *
     * @param value valor atual do campo
     * @return {@code true} se o campo ainda não foi preenchido
     * @throws DependencyGraphException do tipo {@code INACCESSIBLE} se um campo de um valor
     *         {@link Embeddable} não puder ser lido
     */
    public static boolean isNilOrZero(Object value) throws DependencyGraphException {
        if (value == null) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue() == 0;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() == 0;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Character) {
            return (Character) value == '\0';
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }

        Class<?> valueClass = value.getClass();
        if (valueClass.isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) {
                if (!isNilOrZero(Array.get(value, i))) {
                    return false;
                }
            }
            return true;
        }
        if (valueClass.isAnnotationPresent(Embeddable.class)) {
            return isEmbeddableZero(value);
        }
        return false;
    }

    private static boolean isEmbeddableZero(Object value) throws DependencyGraphException {
        for (Field field : getAllFields(value.getClass())) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            try {
                if (!field.trySetAccessible()) {
                    throw inaccessible(value, field, null);
                }
                if (!isNilOrZero(field.get(value))) {
                    return false;
                }
            } catch (IllegalAccessException | SecurityException e) {
                throw inaccessible(value, field, e);
            }
        }
        return true;
    }

    private static DependencyGraphException inaccessible(Object value, Field field, Throwable cause){
        return new DependencyGraphException(
                GraphErrorType.INACCESSIBLE,
                "Campo " + field.getName() + " de " + field.getDeclaringClass().getName()
                        + " inacessível ao verificar o valor zero de " + value.getClass().getName(),
                cause
        );
    }
}
