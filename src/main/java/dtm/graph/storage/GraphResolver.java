package dtm.graph.storage;

import dtm.graph.annotations.Embedded;
import dtm.graph.common.FieldUtils;
import dtm.graph.common.TypeDescriptor;
import dtm.graph.exceptions.DependencyGraphException;
import dtm.graph.exceptions.GraphErrorType;
import dtm.graph.exceptions.InjectionException;
import dtm.graph.exceptions.MalformedDirectiveException;
import dtm.graph.prototypes.Directive;
import dtm.graph.prototypes.FieldKind;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Liga os objetos de um {@link ObjectGraphStorage} em duas fases.
 * <p>
 * A primeira fase resolve diretivas nomeadas, ponteiros, mapas e valores inline, podendo criar
 * novos objetos; os objetos criados entram na fila de trabalho e são visitados na mesma passada.
 * A segunda fase resolve os campos de interface sobre o conjunto de objetos já estável.
 */
@Slf4j
class GraphResolver {

    private final ObjectGraphStorage graph;
    private final Deque<GraphObject> worklist;

    GraphResolver(ObjectGraphStorage graph) {
        this.graph = graph;
        this.worklist = new ArrayDeque<>();
    }

    void resolve() throws DependencyGraphException {
        // Seeded once; objects created from here on are queued only by addLast
        worklist.addAll(graph.getUnnamed());

        for (GraphObject object : new ArrayList<>(graph.getNamed())) {
            if (!object.isComplete()) {
                populateExplicit(object);
            }
        }

        while (!worklist.isEmpty()) {
            GraphObject object = worklist.pollFirst();
            if (!object.isComplete()) {
                populateExplicit(object);
            }
        }

        for (GraphObject object : graph.getUnnamed()) {
            if (!object.isComplete()) {
                populateInterfaces(object);
            }
        }

        for (GraphObject object : graph.getNamed()) {
            if (!object.isComplete()) {
                populateInterfaces(object);
            }
        }
    }

    private void populateExplicit(GraphObject object) throws DependencyGraphException {
        if (object.isNamed() && !object.getTypeDescriptor().isPointerToRecord()) {
            return;
        }

        for (Field field : FieldUtils.getAllFields(object.getType())) {
            final Optional<Directive> parsed = getDirective(object, field);
            if (parsed.isEmpty()) {
                continue;
            }
            final Directive directive = parsed.get();

            if (!FieldUtils.isSettable(field)) {
                throw error(GraphErrorType.INACCESSIBLE, "Injeção solicitada no campo inacessível", object, field);
            }

            final TypeDescriptor fieldType = TypeDescriptor.ofType(field.getType());
            final FieldKind kind = fieldType.getFieldKind();

            if (directive.isInline() && kind != FieldKind.RECORD) {
                throw error(GraphErrorType.INLINE_MISUSE, "Inline solicitado em campo que não é @Embeddable", object, field);
            }

            final Object current = read(object, field);
            if (!isZero(object, field, current)) {
                continue;
            }

            if (directive.isNamed()) {
                assignNamed(object, field, fieldType, directive.getName());
                continue;
            }

            switch (kind) {
                case RECORD:
                    traverseInline(object, field, directive, current);
                    break;
                case INTERFACE:
                    break;
                case MAP:
                    assignMap(object, field, directive);
                    break;
                case POINTER:
                    assignPointer(object, field, fieldType, directive);
                    break;
                default:
                    throw error(GraphErrorType.UNSUPPORTED_FIELD, "Diretiva de injeção em campo não suportado", object, field);
            }
        }
    }

    private void populateInterfaces(GraphObject object) throws DependencyGraphException {
        if (object.isNamed() && !object.getTypeDescriptor().isPointerToRecord()) {
            return;
        }

        for (Field field : FieldUtils.getAllFields(object.getType())) {
            final Optional<Directive> parsed = getDirective(object, field);
            if (parsed.isEmpty()) {
                continue;
            }
            final Directive directive = parsed.get();

            final TypeDescriptor fieldType = TypeDescriptor.ofType(field.getType());
            if (fieldType.getFieldKind() != FieldKind.INTERFACE) {
                continue;
            }

            if (directive.isPrivate()) {
                throw error(GraphErrorType.UNSUPPORTED_FIELD, "Diretiva private em campo de interface", object, field);
            }

            if (!isZero(object, field, read(object, field))) {
                continue;
            }

            if (directive.isNamed()) {
                throw new IllegalStateException("Diretiva nomeada '" + directive.getName() + "' não tratada no campo "
                        + field.getName() + " do tipo " + object.getType().getName());
            }

            final List<GraphObject> candidates = graph.findAllAssignable(fieldType);
            if (candidates.isEmpty()) {
                throw error(GraphErrorType.NO_IMPLEMENTATION,
                        "Nenhuma implementação de " + fieldType + " encontrada", object, field);
            }
            if (candidates.size() > 1) {
                String found = candidates.stream()
                        .map(candidate -> candidate + " (" + candidate.getValue() + ")")
                        .collect(Collectors.joining(", "));
                throw error(GraphErrorType.AMBIGUOUS_IMPLEMENTATION,
                        "Implementação ambígua de " + fieldType + ": " + candidates.size() + " candidatos [" + found + "]",
                        object, field);
            }

            final GraphObject existing = candidates.get(0);
            write(object, field, existing.getValue());
            object.addDependency(field.getName(), existing);
            trace("atribuído existente {} ao campo de interface {} em {}", existing, field.getName(), object);
        }
    }

    private void assignNamed(GraphObject object, Field field, TypeDescriptor fieldType, String name) throws InjectionException {
        final GraphObject existing = graph.getNamed(name);
        if (existing == null) {
            throw error(GraphErrorType.MISSING_NAMED, "Objeto nomeado '" + name + "' não encontrado", object, field);
        }

        if (!existing.getTypeDescriptor().isAssignableTo(fieldType)) {
            throw error(GraphErrorType.TYPE_MISMATCH,
                    "Objeto nomeado '" + name + "' do tipo " + existing.getTypeDescriptor()
                            + " não é atribuível a " + fieldType, object, field);
        }

        write(object, field, existing.getValue());
        object.addDependency(field.getName(), existing);
        trace("atribuído {} ao campo {} em {}", existing, field.getName(), object);
    }

    private void traverseInline(GraphObject object, Field field, Directive directive, Object current) throws DependencyGraphException {
        if (directive.isPrivate()) {
            throw error(GraphErrorType.INLINE_MISUSE, "Diretiva private não pode ser usada em valor inline", object, field);
        }
        if (!directive.isInline()) {
            throw error(GraphErrorType.INLINE_MISUSE, "Campo @Embeddable exige a diretiva explícita \"inline\"", object, field);
        }

        Object value = current;
        if (value == null) {
            value = instantiate(object, field, field.getType());
            write(object, field, value);
        }

        final GraphObject inlined = GraphObject.inlined(value, field.isAnnotationPresent(Embedded.class));
        graph.provide(inlined);
        worklist.addLast(inlined);
    }

    private void assignMap(GraphObject object, Field field, Directive directive) throws InjectionException {
        if (!directive.isPrivate()) {
            throw error(GraphErrorType.MAP_MISUSE, "Injeção em campo Map deve ser nomeada ou private", object, field);
        }

        write(object, field, newMap(object, field));
        trace("criado mapa para o campo {} em {}", field.getName(), object);
    }

    private void assignPointer(GraphObject object, Field field, TypeDescriptor fieldType, Directive directive) throws DependencyGraphException {
        if (!directive.isPrivate()) {
            Optional<GraphObject> existing = graph.findIndexed(fieldType.getType());
            if (existing.isEmpty()) {
                existing = graph.findAssignable(fieldType);
            }
            if (existing.isPresent()) {
                write(object, field, existing.get().getValue());
                object.addDependency(field.getName(), existing.get());
                trace("atribuído existente {} ao campo {} em {}", existing.get(), field.getName(), object);
                return;
            }
        }

        final Object value = instantiate(object, field, fieldType.getType());
        final GraphObject created = GraphObject.synthesized(value, directive.isPrivate());
        graph.provide(created);
        worklist.addLast(created);

        write(object, field, value);
        object.addDependency(field.getName(), created);
        trace("atribuído recém-criado {} ao campo {} em {}", created, field.getName(), object);
    }

    private Optional<Directive> getDirective(GraphObject object, Field field) throws InjectionException {
        try {
            return graph.getDirective(field);
        } catch (MalformedDirectiveException e) {
            throw new InjectionException(
                    GraphErrorType.MALFORMED_DIRECTIVE,
                    "Formato de diretiva inesperado '" + e.getRawDirective() + "' no campo " + field.getName()
                            + " do tipo " + object.getType().getName(),
                    field.getName(),
                    object.getType(),
                    e
            );
        }
    }

    private Object instantiate(GraphObject object, Field field, Class<?> type) throws InjectionException {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
                 | InvocationTargetException | RuntimeException e) {
            throw new InjectionException(
                    GraphErrorType.UNSUPPORTED_FIELD,
                    "Não foi possível criar " + type.getName() + " para o campo " + field.getName()
                            + " do tipo " + object.getType().getName() + " ==> causa: " + e,
                    field.getName(),
                    object.getType(),
                    e
            );
        }
    }

    private Map<?, ?> newMap(GraphObject object, Field field) throws InjectionException {
        final Class<?> type = field.getType();
        if (!type.isInterface() && !Modifier.isAbstract(type.getModifiers())) {
            return (Map<?, ?>) instantiate(object, field, type);
        }
        if (type.isAssignableFrom(HashMap.class)) {
            return new HashMap<>();
        }
        if (type.isAssignableFrom(TreeMap.class)) {
            return new TreeMap<>();
        }
        if (type.isAssignableFrom(ConcurrentHashMap.class)) {
            return new ConcurrentHashMap<>();
        }
        if (type.isAssignableFrom(ConcurrentSkipListMap.class)) {
            return new ConcurrentSkipListMap<>();
        }
        throw error(GraphErrorType.UNSUPPORTED_FIELD, "Tipo de Map sem implementação padrão: " + type.getName(), object, field);
    }

    private boolean isZero(GraphObject object, Field field, Object value) throws InjectionException {
        try {
            return FieldUtils.isNilOrZero(value);
        } catch (DependencyGraphException e) {
            throw new InjectionException(e.getErrorType(), describe(e.getMessage(), object, field),
                    field.getName(), object.getType(), e);
        }
    }

    private Object read(GraphObject object, Field field) throws InjectionException {
        try {
            return field.get(object.getValue());
        } catch (IllegalAccessException e) {
            throw new InjectionException(GraphErrorType.INACCESSIBLE,
                    describe("Campo inacessível", object, field), field.getName(), object.getType(), e);
        }
    }

    private void write(GraphObject object, Field field, Object value) throws InjectionException {
        try {
            field.set(object.getValue(), value);
        } catch (IllegalAccessException e) {
            throw new InjectionException(GraphErrorType.INACCESSIBLE,
                    describe("Campo inacessível", object, field), field.getName(), object.getType(), e);
        }
    }

    private InjectionException error(GraphErrorType type, String message, GraphObject object, Field field){
        return new InjectionException(type, describe(message, object, field), field.getName(), object.getType());
    }

    private String describe(String message, GraphObject object, Field field){
        return message + ": campo " + field.getName() + " do tipo " + object.getType().getName();
    }

    private void trace(String format, Object... args){
        if (graph.isDebugTraceEnabled() && log.isDebugEnabled()) {
            log.debug(format, args);
        }
    }
}
