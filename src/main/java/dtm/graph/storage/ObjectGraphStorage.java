package dtm.graph.storage;

import dtm.graph.annotations.Inject;
import dtm.graph.common.DirectiveParser;
import dtm.graph.common.TypeDescriptor;
import dtm.graph.core.ObjectGraph;
import dtm.graph.exceptions.DependencyGraphException;
import dtm.graph.exceptions.GraphErrorType;
import dtm.graph.exceptions.InvalidObjectProvideException;
import dtm.graph.prototypes.Directive;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
public class ObjectGraphStorage implements ObjectGraph {

    private final List<GraphObject> unnamed;
    private final Set<Class<?>> unnamedTypes;
    private final Map<String, GraphObject> named;
    private final Map<String, Optional<Directive>> directiveCache;
    private Map<Class<?>, List<GraphObject>> typeIndex;
    private boolean debugTrace;

    public ObjectGraphStorage(){
        this.unnamed = new ArrayList<>();
        this.unnamedTypes = new HashSet<>();
        this.named = new LinkedHashMap<>();
        this.directiveCache = new HashMap<>();
        this.debugTrace = Boolean.getBoolean(DEBUG_TRACE_PROPERTY);
    }

    /**
     * Atalho que cria um grafo, fornece cada valor como objeto sem nome e o liga.
     *
     * @param values valores incompletos
     * @return o grafo ligado
     */
    public static ObjectGraphStorage populateAll(@NonNull Object... values) throws DependencyGraphException {
        ObjectGraphStorage graph = new ObjectGraphStorage();
        for (Object value : values) {
            graph.provide(GraphObject.of(value));
        }
        graph.populate();
        return graph;
    }

    @Override
    public void provide(@NonNull GraphObject... objects) throws InvalidObjectProvideException {
        final List<GraphObject> stagedUnnamed = new ArrayList<>();
        final Set<Class<?>> stagedTypes = new HashSet<>();
        final Map<String, GraphObject> stagedNamed = new LinkedHashMap<>();

        for (GraphObject object : objects) {
            Objects.requireNonNull(object, "object não pode ser null");
            final TypeDescriptor descriptor = TypeDescriptor.of(object.getValue());
            object.setTypeDescriptor(descriptor);

            if (object.hasFields()) {
                throw new InvalidObjectProvideException(
                        GraphErrorType.PRE_WIRED_OBJECT,
                        "Campos já preenchidos no objeto " + object + " ao ser fornecido",
                        descriptor.getType()
                );
            }

            if (object.isNamed()) {
                validName(object, stagedNamed);
                stagedNamed.put(object.getName(), object);
            } else {
                validUnnamed(object, descriptor, stagedTypes);
                stagedUnnamed.add(object);
            }
        }

        unnamed.addAll(stagedUnnamed);
        unnamedTypes.addAll(stagedTypes);
        named.putAll(stagedNamed);

        stagedUnnamed.forEach(this::traceProvided);
        stagedNamed.values().forEach(this::traceProvided);
    }

    @Override
    public void populate() throws DependencyGraphException {
        new GraphResolver(this).resolve();
    }

    @Override
    public List<GraphObject> getObjects() {
        List<GraphObject> objects = new ArrayList<>(unnamed.size() + named.size());
        for (GraphObject object : unnamed) {
            if (!object.isEmbedded()) objects.add(object);
        }
        for (GraphObject object : named.values()) {
            if (!object.isEmbedded()) objects.add(object);
        }
        return objects;
    }

    @Override
    public Optional<GraphObject> getNamedObject(String name) {
        return Optional.ofNullable(named.get(name));
    }

    @Override
    public void enableDebugTrace() {
        this.debugTrace = true;
    }

    @Override
    public void disableDebugTrace() {
        this.debugTrace = false;
    }

    @Override
    public boolean isDebugTraceEnabled() {
        return debugTrace;
    }

    List<GraphObject> getUnnamed(){
        return unnamed;
    }

    Collection<GraphObject> getNamed(){
        return named.values();
    }

    GraphObject getNamed(String name){
        return named.get(name);
    }

    /**
     * Diretiva do campo, memorizada pelo valor bruto da anotação.
     * Erros de interpretação não são memorizados.
     */
    Optional<Directive> getDirective(Field field){
        final Inject inject = field.getAnnotation(Inject.class);
        if (inject == null) {
            return Optional.empty();
        }

        final String raw = inject.value();
        Optional<Directive> cached = directiveCache.get(raw);
        if (cached == null) {
            cached = DirectiveParser.parse(raw);
            directiveCache.put(raw, cached);
        }
        return cached;
    }

    int getDirectiveCacheSize(){
        return directiveCache.size();
    }

    /**
     * Busca pelo tipo exato no índice. O índice é montado uma única vez, no primeiro uso,
     * e não enxerga objetos criados depois disso.
     */
    Optional<GraphObject> findIndexed(Class<?> type){
        if (typeIndex == null) {
            buildTypeIndex();
        }
        return typeIndex.getOrDefault(type, Collections.emptyList())
                .stream()
                .filter(candidate -> !candidate.isPrivateInstance())
                .findFirst();
    }

    Optional<GraphObject> findAssignable(TypeDescriptor target){
        return unnamed.stream()
                .filter(candidate -> !candidate.isPrivateInstance())
                .filter(candidate -> candidate.getTypeDescriptor().isAssignableTo(target))
                .findFirst();
    }

    List<GraphObject> findAllAssignable(TypeDescriptor target){
        return unnamed.stream()
                .filter(candidate -> !candidate.isPrivateInstance())
                .filter(candidate -> candidate.getTypeDescriptor().isAssignableTo(target))
                .collect(Collectors.toList());
    }

    boolean isTypeIndexBuilt(){
        return typeIndex != null;
    }

    private void buildTypeIndex(){
        typeIndex = new HashMap<>();
        for (GraphObject object : unnamed) {
            if (object.isPrivateInstance()) {
                continue;
            }
            typeIndex.computeIfAbsent(object.getType(), k -> new ArrayList<>()).add(object);
        }
    }

    private void validName(GraphObject object, Map<String, GraphObject> stagedNamed) throws InvalidObjectProvideException {
        if (named.containsKey(object.getName()) || stagedNamed.containsKey(object.getName())) {
            throw new InvalidObjectProvideException(
                    GraphErrorType.DUPLICATE_NAME,
                    "Dois objetos fornecidos com o nome " + object.getName(),
                    object.getType()
            );
        }
    }

    private void validUnnamed(GraphObject object, TypeDescriptor descriptor, Set<Class<?>> stagedTypes) throws InvalidObjectProvideException {
        final Class<?> type = descriptor.getType();

        if (!descriptor.isPointerToRecord()) {
            throw new InvalidObjectProvideException(
                    GraphErrorType.SHAPE_VIOLATION,
                    "Objeto sem nome deve ser a instância de uma classe concreta, mas foi recebido o tipo "
                            + descriptor + " com valor " + object.getValue(),
                    type
            );
        }

        if (object.isPrivateInstance()) {
            return;
        }

        if (unnamedTypes.contains(type) || !stagedTypes.add(type)) {
            throw new InvalidObjectProvideException(
                    GraphErrorType.DUPLICATE_TYPE,
                    "Duas instâncias sem nome fornecidas para o tipo " + type.getName(),
                    type
            );
        }
    }

    private void traceProvided(GraphObject object){
        if (!debugTrace || !log.isDebugEnabled()) {
            return;
        }
        if (object.isCreated()) {
            log.debug("criado {}", object);
        } else if (object.isEmbedded()) {
            log.debug("fornecido embutido {}", object);
        } else {
            log.debug("fornecido {}", object);
        }
    }
}
